package com.lexguard.security;

/**
 * Sink for structured security audit entries.
 */
public interface SecurityAuditLog {

    void record(SecurityAuditEvent event);
}
