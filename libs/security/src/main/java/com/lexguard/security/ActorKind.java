package com.lexguard.security;

/**
 * The three shapes an actor can take.
 */
public enum ActorKind {

    /** Member of a firm, scoped by {@code firmId}. */
    FIRM_MEMBER("firm_member"),

    /** Former member of a firm: firm-scoped and additionally restricted to their own documents. */
    DEPARTED_MEMBER("departed_member"),

    /** Solo practitioner acting as their own tenant, scoped by {@code lawyerId}. */
    SOLO_PRACTITIONER("solo_practitioner");

    private final String value;

    ActorKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
