package com.lexguard.security;

import com.lexguard.observability.SecurityMetrics;
import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership status changes, driven by a team manager of the same firm.
 * <p>
 * Each operation accepts exactly one source status (see {@link MemberStatus} for the graph).
 * The firm owner cannot be suspended, departed or terminated, and nobody changes their own
 * status. Departing sets the role to {@link FirmRole#DEPARTED} and stamps {@code departedAt};
 * rehiring assigns a new role and clears overrides and the departure stamp. Terminating also
 * revokes every resource grant of the member.
 */
public class MemberLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MemberLifecycle.class);

    private static final String COLLECTION = "members";
    private static final Set<FirmRole> REHIRE_ROLES = EnumSet.of(
            FirmRole.ADMIN, FirmRole.PARTNER, FirmRole.LAWYER,
            FirmRole.PARALEGAL, FirmRole.SECRETARY, FirmRole.ACCOUNTANT);

    private final FirmAdministration administration;
    private final ResourceGrantStore grantStore;
    private final Clock clock;

    public MemberLifecycle(
            MemberDirectory directory,
            ResourceGrantStore grantStore,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog,
            Clock clock) {
        if (grantStore == null || clock == null) {
            throw new IllegalArgumentException("grantStore and clock must not be null");
        }
        this.administration = new FirmAdministration(directory, metrics, auditLog);
        this.grantStore = grantStore;
        this.clock = clock;
    }

    /** pending_approval to active. */
    public Member approve(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.PENDING_APPROVAL, MemberStatus.ACTIVE, UnaryOperator.identity());
    }

    /** active to suspended. */
    public Member suspend(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.ACTIVE, MemberStatus.SUSPENDED, UnaryOperator.identity());
    }

    /** suspended to active. */
    public Member reinstate(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.SUSPENDED, MemberStatus.ACTIVE, UnaryOperator.identity());
    }

    /** active to on_leave. */
    public Member startLeave(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.ACTIVE, MemberStatus.ON_LEAVE, UnaryOperator.identity());
    }

    /** on_leave to active. */
    public Member endLeave(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.ON_LEAVE, MemberStatus.ACTIVE, UnaryOperator.identity());
    }

    /**
     * active to departed. The member keeps read access to what they own or are assigned to.
     */
    public Member depart(LexguardSecurityContext caller, String memberId) {
        return transition(caller, memberId, MemberStatus.ACTIVE, MemberStatus.DEPARTED,
                member -> member.withRole(FirmRole.DEPARTED).withDepartedAt(clock.instant()));
    }

    /**
     * departed to active with a fresh role.
     *
     * @param role the role to rehire into; owner, departed and solo are not allowed
     */
    public Member rehire(LexguardSecurityContext caller, String memberId, FirmRole role) {
        if (role == null || !REHIRE_ROLES.contains(role)) {
            throw new IllegalArgumentException("Cannot rehire into role " + (role == null ? null : role.value()));
        }
        return transition(caller, memberId, MemberStatus.DEPARTED, MemberStatus.ACTIVE,
                member -> member.withRole(role)
                        .withDepartedAt(null)
                        .withPermissionOverrides(Map.of())
                        .withSpecialOverrides(Map.of()));
    }

    /**
     * Any status to terminated. Revokes all of the member's resource grants.
     */
    public Member terminate(LexguardSecurityContext caller, String memberId) {
        Member terminated = transition(caller, memberId, null, MemberStatus.TERMINATED, UnaryOperator.identity());
        List<ResourceGrant> grants = grantStore.findByMember(terminated.id());
        grants.forEach(grant -> grantStore.revoke(grant.key()));
        if (!grants.isEmpty()) {
            log.info("Revoked {} resource grants of terminated member {}", grants.size(), terminated.id());
        }
        return terminated;
    }

    /**
     * Checks and writes the new status against the directory's current record in one atomic
     * update, so two concurrent changes of one member cannot both pass their source check.
     *
     * @param from the only accepted source status, or {@code null} for any status the graph allows
     */
    private Member transition(
            LexguardSecurityContext caller,
            String memberId,
            MemberStatus from,
            MemberStatus to,
            UnaryOperator<Member> change) {
        administration.requireTeamManager(caller);
        Member member = administration.memberOfCallerFirm(caller, memberId, COLLECTION);
        AtomicReference<MemberStatus> previous = new AtomicReference<>();
        Member updated = administration.directory().update(member.id(), current -> {
            checkTransition(caller, current, from, to);
            previous.set(current.status());
            return change.apply(current.withStatus(to));
        });

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("memberId", updated.id());
        attributes.put("from", previous.get().value());
        attributes.put("to", to.value());
        attributes.put("role", updated.role());
        administration.auditLog().record(SecurityAuditEvent.of(
                AuditEventType.MEMBER_STATUS_CHANGED, AuditSeverity.INFO, caller.userId(),
                caller.scope().render(), COLLECTION,
                "Member %s moved from %s to %s".formatted(updated.id(), previous.get().value(), to.value()),
                attributes));
        return updated;
    }

    private static void checkTransition(
            LexguardSecurityContext caller, Member member, MemberStatus from, MemberStatus to) {
        MemberStatus status = member.status();
        if ((from != null && status != from) || !status.canTransitionTo(to)) {
            throw new IllegalMemberTransitionException(member.id(), status, to);
        }
        if (member.userId().equals(caller.userId())) {
            throw new IllegalMemberTransitionException("Members cannot change their own membership status");
        }
        if (member.firmRole().filter(role -> role == FirmRole.OWNER).isPresent()
                && (to == MemberStatus.SUSPENDED || to == MemberStatus.DEPARTED || to == MemberStatus.TERMINATED)) {
            throw new IllegalMemberTransitionException(
                    "The firm owner cannot become %s until ownership is transferred".formatted(to.value()));
        }
    }
}
