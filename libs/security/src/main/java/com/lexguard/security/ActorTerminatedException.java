package com.lexguard.security;

/**
 * Thrown when the membership behind an identity is terminated. Terminated is a sink status, so
 * every later resolution fails the same way.
 */
public class ActorTerminatedException extends TenantSecurityException {

    private final String userId;
    private final String firmId;

    public ActorTerminatedException(String userId, String firmId) {
        super(ErrorCategory.AUTHENTICATION,
                "Membership of user '%s' in firm '%s' is terminated".formatted(userId, firmId));
        this.userId = userId;
        this.firmId = firmId;
    }

    public String userId() {
        return userId;
    }

    public String firmId() {
        return firmId;
    }
}
