package com.lexguard.security;

/**
 * Thrown when an identity is ambiguous or malformed: it is never guessed into an open or a
 * closed context.
 */
public class InvalidActorIdentityException extends TenantSecurityException {

    public InvalidActorIdentityException(String reason) {
        super(ErrorCategory.AUTHENTICATION, "Invalid actor identity: " + reason);
    }
}
