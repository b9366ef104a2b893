package com.lexguard.security;

/**
 * Severity of an audit entry. {@link #CRITICAL} entries are security incidents and must page.
 */
public enum AuditSeverity {
    INFO,
    WARN,
    CRITICAL
}
