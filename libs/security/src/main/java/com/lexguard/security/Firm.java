package com.lexguard.security;

/**
 * A law firm tenant.
 *
 * @param id   unique firm identifier, the value of the {@code firmId} tenant key
 * @param name display name
 * @param tier subscription tier
 */
public record Firm(String id, String name, SubscriptionTier tier) {

    public Firm {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tier == null) {
            tier = SubscriptionTier.FREE;
        }
    }
}
