package com.lexguard.security;

import java.time.Instant;

/**
 * Capability to run tenant-scoped operations without a scope predicate.
 * <p>
 * Only {@link QueryIsolationEnforcer#withBypass} creates instances, and an instance is closed
 * as soon as the bypass callback returns; a retained reference cannot be used later.
 */
public final class SystemContext {

    private final String callerIdentity;
    private final String reason;
    private final Instant openedAt;
    private volatile boolean active = true;

    SystemContext(String callerIdentity, String reason, Instant openedAt) {
        this.callerIdentity = callerIdentity;
        this.reason = reason;
        this.openedAt = openedAt;
    }

    /** The system caller that opened the bypass, e.g. {@code migration:2024-06-backfill}. */
    public String callerIdentity() {
        return callerIdentity;
    }

    public String reason() {
        return reason;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public boolean isActive() {
        return active;
    }

    void close() {
        active = false;
    }

    @Override
    public String toString() {
        return "SystemContext[caller=" + callerIdentity + ", reason=" + reason + ", active=" + active + "]";
    }
}
