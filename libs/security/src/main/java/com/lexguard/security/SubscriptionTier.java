package com.lexguard.security;

/**
 * Subscription tiers of a firm.
 */
public enum SubscriptionTier {

    FREE("free"),
    STARTER("starter"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
