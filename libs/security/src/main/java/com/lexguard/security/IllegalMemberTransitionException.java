package com.lexguard.security;

/**
 * Thrown when a membership change is not allowed from the member's current state.
 */
public class IllegalMemberTransitionException extends TenantSecurityException {

    public IllegalMemberTransitionException(String memberId, MemberStatus from, MemberStatus to) {
        this("Member '%s' cannot move from %s to %s".formatted(memberId, from.value(), to.value()));
    }

    public IllegalMemberTransitionException(String message) {
        super(ErrorCategory.CONFLICT, message);
    }
}
