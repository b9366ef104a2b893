package com.lexguard.security;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the {@link ActorContext} of a request from an authenticated {@link ActorIdentity}.
 * <p>
 * <ul>
 *   <li>no firm ID: solo practitioner, scoped by {@code lawyerId == userId}, full role</li>
 *   <li>firm ID: firm member, scoped by {@code firmId}; the member record decides role and status</li>
 *   <li>suspended or pending approval: resolved, flagged deny-all</li>
 *   <li>departed: resolved, carries the self-scope restriction</li>
 *   <li>terminated: {@link ActorTerminatedException}</li>
 *   <li>no membership record: {@link ActorNotProvisionedException}</li>
 *   <li>ambiguous input: {@link InvalidActorIdentityException}</li>
 * </ul>
 * Every rejection is audit-logged before it is thrown.
 */
public class TenantContextResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);

    private final MemberDirectory directory;
    private final SecurityAuditLog auditLog;

    public TenantContextResolver(MemberDirectory directory, SecurityAuditLog auditLog) {
        if (directory == null || auditLog == null) {
            throw new IllegalArgumentException("directory and auditLog must not be null");
        }
        this.directory = directory;
        this.auditLog = auditLog;
    }

    /**
     * Resolves the identity.
     *
     * @throws InvalidActorIdentityException if the identity is ambiguous
     * @throws ActorNotProvisionedException  if the firm or membership does not exist
     * @throws ActorTerminatedException      if the membership is terminated
     */
    public ActorContext resolve(ActorIdentity identity) {
        try {
            return doResolve(identity);
        } catch (TenantSecurityException e) {
            String actor = identity == null ? null : identity.userId();
            String scope = identity == null || identity.firmId() == null ? null : "firm:" + identity.firmId();
            auditLog.record(SecurityAuditEvent.of(
                    AuditEventType.ACTOR_REJECTED, AuditSeverity.WARN, actor, scope, null,
                    e.getMessage(), Map.of("reason", e.getClass().getSimpleName())));
            throw e;
        }
    }

    private ActorContext doResolve(ActorIdentity identity) {
        if (identity == null) {
            throw new InvalidActorIdentityException("identity is missing");
        }
        String userId = identity.userId();
        if (userId == null || userId.isBlank()) {
            throw new InvalidActorIdentityException("userId is missing");
        }
        Optional<MemberStatus> statusClaim = parseStatusClaim(identity);

        if (identity.firmId() == null) {
            if (identity.firmRole() != null || statusClaim.isPresent()) {
                throw new InvalidActorIdentityException("role or status claim without a firm");
            }
            return ActorContext.solo(userId);
        }
        String firmId = identity.firmId();
        if (firmId.isBlank()) {
            throw new InvalidActorIdentityException("firmId is blank");
        }
        if (statusClaim.filter(status -> status == MemberStatus.TERMINATED).isPresent()) {
            throw new ActorTerminatedException(userId, firmId);
        }
        if (directory.findFirm(firmId).isEmpty()) {
            throw new ActorNotProvisionedException(userId, firmId);
        }
        Member member = directory.findMember(firmId, userId)
                .orElseThrow(() -> new ActorNotProvisionedException(userId, firmId));

        MemberStatus status = member.status();
        if (status == MemberStatus.TERMINATED) {
            throw new ActorTerminatedException(userId, firmId);
        }
        if (identity.firmRole() != null && !identity.firmRole().equals(member.role())) {
            log.debug("Role claim '{}' of user {} differs from stored role '{}'; using stored role",
                    identity.firmRole(), userId, member.role());
        }

        ScopePredicate scope = ScopePredicate.firm(firmId);
        Optional<FirmRole> role = member.firmRole();
        return switch (status) {
            case DEPARTED -> new ActorContext(userId, ActorKind.DEPARTED_MEMBER, scope, role, status,
                    false, new SelfScopeRestriction(userId), member);
            case SUSPENDED, PENDING_APPROVAL -> new ActorContext(userId, ActorKind.FIRM_MEMBER, scope, role, status,
                    true, null, member);
            case ACTIVE, ON_LEAVE -> new ActorContext(userId, ActorKind.FIRM_MEMBER, scope, role, status,
                    false, null, member);
            case TERMINATED -> throw new ActorTerminatedException(userId, firmId);
        };
    }

    private static Optional<MemberStatus> parseStatusClaim(ActorIdentity identity) {
        if (identity.memberStatus() == null) {
            return Optional.empty();
        }
        return Optional.of(MemberStatus.fromString(identity.memberStatus())
                .orElseThrow(() -> new InvalidActorIdentityException(
                        "unknown member status '%s'".formatted(identity.memberStatus()))));
    }
}
