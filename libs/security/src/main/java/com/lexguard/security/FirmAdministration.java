package com.lexguard.security;

import com.lexguard.observability.SecurityMetrics;
import java.util.Map;

/**
 * Checks shared by the administrative operations on a firm's members and grants.
 */
final class FirmAdministration {

    private final MemberDirectory directory;
    private final SecurityMetrics metrics;
    private final SecurityAuditLog auditLog;

    FirmAdministration(MemberDirectory directory, SecurityMetrics metrics, SecurityAuditLog auditLog) {
        if (directory == null || metrics == null || auditLog == null) {
            throw new IllegalArgumentException("directory, metrics and auditLog must not be null");
        }
        this.directory = directory;
        this.metrics = metrics;
        this.auditLog = auditLog;
    }

    /**
     * Requires a firm owner or admin, or a member holding {@link SpecialPermission#CAN_MANAGE_TEAM}.
     */
    void requireTeamManager(LexguardSecurityContext caller) {
        ActorContext actor = caller.actor();
        if (actor.isSolo()) {
            throw new PermissionDeniedException("Team administration is only available to firms");
        }
        boolean administrator = !actor.denyAll()
                && actor.kind() == ActorKind.FIRM_MEMBER
                && actor.role().map(FirmRole::isFirmAdministrator).orElse(false);
        if (!administrator && !caller.hasSpecialPermission(SpecialPermission.CAN_MANAGE_TEAM)) {
            throw PermissionDeniedException.special(SpecialPermission.CAN_MANAGE_TEAM);
        }
    }

    /**
     * Loads a member of the caller's firm.
     *
     * @throws IllegalArgumentException      if the member does not exist
     * @throws CrossTenantViolationException if the member belongs to another firm
     */
    Member memberOfCallerFirm(LexguardSecurityContext caller, String memberId, String collection) {
        Member member = directory.findMemberById(memberId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown member: " + memberId));
        ScopePredicate scope = caller.scope();
        if (!member.firmId().equals(scope.tenantValue()) || !(scope instanceof ScopePredicate.FirmScope)) {
            CrossTenantViolationException violation =
                    new CrossTenantViolationException(collection, scope, "firm:" + member.firmId());
            long total = metrics.recordViolation(QueryIsolationEnforcer.VIOLATION_CROSS_TENANT);
            auditLog.record(SecurityAuditEvent.of(
                    AuditEventType.CROSS_TENANT_VIOLATION, AuditSeverity.CRITICAL, caller.userId(),
                    scope.render(), collection, violation.getMessage(),
                    Map.of("memberId", memberId, "violationCount", total)));
            throw violation;
        }
        return member;
    }

    MemberDirectory directory() {
        return directory;
    }

    SecurityAuditLog auditLog() {
        return auditLog;
    }
}
