package com.lexguard.security;

import java.util.Optional;

/**
 * Authenticated identity handed over by the authentication layer, after token or session
 * validation.
 * <p>
 * Only {@code userId} is mandatory. A missing {@code firmId} means the caller is a solo
 * practitioner; {@code firmRole} and {@code memberStatus} are the claims the authentication
 * layer saw and are checked against the member directory, which stays authoritative.
 *
 * @param userId       platform user ID
 * @param firmId       firm the caller acts for (nullable)
 * @param firmRole     role claim (nullable)
 * @param memberStatus membership status claim (nullable)
 */
public record ActorIdentity(String userId, String firmId, String firmRole, String memberStatus) {

    /** Identity of a solo practitioner. */
    public static ActorIdentity solo(String userId) {
        return new ActorIdentity(userId, null, null, null);
    }

    /** Identity of a firm member without role or status claims. */
    public static ActorIdentity member(String userId, String firmId) {
        return new ActorIdentity(userId, firmId, null, null);
    }

    public Optional<String> firm() {
        return Optional.ofNullable(firmId);
    }

    public Optional<String> roleClaim() {
        return Optional.ofNullable(firmRole);
    }

    public Optional<String> statusClaim() {
        return Optional.ofNullable(memberStatus);
    }
}
