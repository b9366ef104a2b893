package com.lexguard.security;

/**
 * Thrown when a grant write expected a version that is no longer current.
 */
public class ConcurrentGrantModificationException extends TenantSecurityException {

    private final ResourceKey key;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentGrantModificationException(ResourceKey key, long expectedVersion, long actualVersion) {
        super(ErrorCategory.CONFLICT,
                "Grant %s was modified concurrently: expected version %d, found %d"
                        .formatted(key, expectedVersion, actualVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public ResourceKey key() {
        return key;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
