package com.lexguard.security;

import com.lexguard.observability.SecurityMetrics;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative surface of the {@link ResourceGrantStore}.
 * <p>
 * Callers must manage the team of their firm (owner, admin, or {@code canManageTeam}) and may
 * only touch grants of members of that firm. Departed and terminated members cannot receive
 * grants, and resource types must belong to a {@link PracticeModule}. Every change is audit-logged. Writes accept an
 * optional expected version; without one the write is unconditional but still serialized per
 * key by the store.
 */
public class ResourceGrantService {

    static final String COLLECTION = "resource_grants";

    private static final Set<MemberStatus> GRANTABLE = EnumSet.of(
            MemberStatus.ACTIVE, MemberStatus.ON_LEAVE, MemberStatus.SUSPENDED, MemberStatus.PENDING_APPROVAL);

    private static final Logger log = LoggerFactory.getLogger(ResourceGrantService.class);

    private final ResourceGrantStore store;
    private final FirmAdministration administration;

    public ResourceGrantService(
            ResourceGrantStore store,
            MemberDirectory directory,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.administration = new FirmAdministration(directory, metrics, auditLog);
    }

    /**
     * Creates or replaces a grant.
     *
     * @throws PermissionDeniedException             if the caller may not manage the team
     * @throws IllegalArgumentException              if the type maps to no module or the member is
     *                                               departed or terminated
     * @throws CrossTenantViolationException         if the member belongs to another firm
     * @throws ConcurrentGrantModificationException if {@code expectedVersion} is stale
     */
    public ResourceGrant grant(
            LexguardSecurityContext caller,
            String resourceType,
            String resourceId,
            String memberId,
            AccessLevel level,
            OptionalLong expectedVersion) {
        administration.requireTeamManager(caller);
        Member member = administration.memberOfCallerFirm(caller, memberId, COLLECTION);
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (PracticeModule.forResourceType(resourceType).isEmpty()) {
            throw new IllegalArgumentException("Resource type '%s' belongs to no module".formatted(resourceType));
        }
        requireGrantable(member);
        ResourceKey key = new ResourceKey(resourceType, resourceId, memberId);
        ResourceGrant grant = expectedVersion.isPresent()
                ? store.put(key, level, caller.userId(), expectedVersion.getAsLong())
                : store.put(key, level, caller.userId());
        boolean stillGrantable = administration.directory().findMemberById(memberId)
                .map(current -> GRANTABLE.contains(current.status()))
                .orElse(false);
        if (!stillGrantable) {
            store.revoke(key);
            throw new IllegalArgumentException(
                    "Member '%s' left the firm while the grant was written".formatted(memberId));
        }
        log.info("Grant {} set to {} (version {}) by {}", key, level.value(), grant.version(), caller.userId());
        audit(caller, AuditEventType.GRANT_CHANGED, key, Map.of("level", level.value(), "version", grant.version()));
        return grant;
    }

    /**
     * Removes a grant.
     *
     * @return the removed grant, or empty if there was none
     */
    public Optional<ResourceGrant> revoke(
            LexguardSecurityContext caller,
            String resourceType,
            String resourceId,
            String memberId,
            OptionalLong expectedVersion) {
        administration.requireTeamManager(caller);
        administration.memberOfCallerFirm(caller, memberId, COLLECTION);
        ResourceKey key = new ResourceKey(resourceType, resourceId, memberId);
        Optional<ResourceGrant> removed = expectedVersion.isPresent()
                ? store.revoke(key, expectedVersion.getAsLong())
                : store.revoke(key);
        removed.ifPresent(grant -> audit(caller, AuditEventType.GRANT_REVOKED, key,
                Map.of("level", grant.level().value(), "version", grant.version())));
        return removed;
    }

    private static void requireGrantable(Member member) {
        if (!GRANTABLE.contains(member.status())) {
            throw new IllegalArgumentException(
                    "Member '%s' is %s and cannot receive grants".formatted(member.id(), member.status().value()));
        }
    }

    public List<ResourceGrant> listForMember(LexguardSecurityContext caller, String memberId) {
        administration.requireTeamManager(caller);
        administration.memberOfCallerFirm(caller, memberId, COLLECTION);
        return store.findByMember(memberId);
    }

    /**
     * Grants on one resource, restricted to members of the caller's firm.
     */
    public List<ResourceGrant> listForResource(LexguardSecurityContext caller, String resourceType, String resourceId) {
        administration.requireTeamManager(caller);
        String firmId = caller.scope().tenantValue();
        MemberDirectory directory = administration.directory();
        return store.findByResource(resourceType, resourceId).stream()
                .filter(grant -> directory.findMemberById(grant.key().memberId())
                        .map(member -> member.firmId().equals(firmId))
                        .orElse(false))
                .toList();
    }

    private void audit(LexguardSecurityContext caller, AuditEventType type, ResourceKey key, Map<String, Object> extra) {
        Map<String, Object> attributes = new LinkedHashMap<>(extra);
        attributes.put("resourceId", key.resourceId());
        attributes.put("memberId", key.memberId());
        administration.auditLog().record(SecurityAuditEvent.of(
                type, AuditSeverity.INFO, caller.userId(), caller.scope().render(), key.resourceType(),
                type.name().toLowerCase() + " " + key, attributes));
    }
}
