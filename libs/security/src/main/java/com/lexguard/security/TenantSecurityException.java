package com.lexguard.security;

/**
 * Base of every error raised by the isolation and permission core.
 * <p>
 * {@link #getMessage()} carries full internal detail for logs; {@link #publicMessage()} is what
 * may be shown to an end user. Only authorization failures expose their detail publicly.
 */
public abstract class TenantSecurityException extends RuntimeException {

    private final ErrorCategory category;

    protected TenantSecurityException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    /** Message safe to surface to end users. */
    public String publicMessage() {
        return switch (category) {
            case AUTHENTICATION -> "Authentication required";
            case AUTHORIZATION -> getMessage();
            case CONFLICT -> "The resource was modified concurrently or is in a conflicting state";
            case PROGRAMMING_ERROR, SECURITY_INCIDENT -> "An unexpected error occurred";
        };
    }

    /** Whether retrying the same operation could succeed. */
    public boolean isRetryable() {
        return false;
    }
}
