package com.lexguard.security;

/**
 * Kinds of structured security audit entries.
 */
public enum AuditEventType {
    FIRM_ISOLATION_VIOLATION,
    CROSS_TENANT_VIOLATION,
    BYPASS_OPENED,
    BYPASS_OPERATION,
    ACTOR_REJECTED,
    GRANT_CHANGED,
    GRANT_REVOKED,
    MEMBER_STATUS_CHANGED
}
