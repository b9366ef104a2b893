package com.lexguard.security;

/**
 * Thrown when an identity names a firm the user has no membership record in.
 */
public class ActorNotProvisionedException extends TenantSecurityException {

    private final String userId;
    private final String firmId;

    public ActorNotProvisionedException(String userId, String firmId) {
        super(ErrorCategory.AUTHENTICATION,
                "User '%s' is not provisioned in firm '%s'".formatted(userId, firmId));
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
