package com.lexguard.security;

/**
 * Thrown when the caller's effective permissions lack the required level. The message is safe
 * to show to end users.
 */
public class PermissionDeniedException extends TenantSecurityException {

    public PermissionDeniedException(String message) {
        super(ErrorCategory.AUTHORIZATION, message);
    }

    public static PermissionDeniedException module(PracticeModule module, AccessLevel required) {
        return new PermissionDeniedException(
                "Requires %s access to %s".formatted(required.value(), module.value()));
    }

    public static PermissionDeniedException special(SpecialPermission flag) {
        return new PermissionDeniedException("Requires the %s permission".formatted(flag.value()));
    }

    public static PermissionDeniedException resource(String resourceType, String resourceId, AccessLevel required) {
        return new PermissionDeniedException(
                "Requires %s access to %s %s".formatted(required.value(), resourceType, resourceId));
    }
}
