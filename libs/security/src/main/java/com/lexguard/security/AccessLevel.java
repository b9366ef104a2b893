package com.lexguard.security;

import java.util.Optional;

/**
 * Module access levels, ordered {@code none < view < edit < full}.
 * <p>
 * Comparisons use the declaration order, so the constants must never be reordered.
 */
public enum AccessLevel {

    NONE("none"),
    VIEW("view"),
    EDIT("edit"),
    FULL("full");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    /** The canonical wire value (e.g., "edit"). */
    public String value() {
        return value;
    }

    /**
     * Returns true if this level satisfies the required level.
     */
    public boolean satisfies(AccessLevel required) {
        return compareTo(required) >= 0;
    }

    /** The lower of the two levels. */
    public static AccessLevel min(AccessLevel a, AccessLevel b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /** The higher of the two levels. */
    public static AccessLevel max(AccessLevel a, AccessLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Optional<AccessLevel> fromString(String value) {
        for (AccessLevel level : values()) {
            if (level.value.equals(value)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
