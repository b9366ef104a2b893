package com.lexguard.security;

import java.util.Optional;

/**
 * Roles an actor can hold. Firm members carry one of the firm roles; {@link #SOLO} is the
 * implicit role of a practitioner acting as their own tenant.
 * <p>
 * Every constant must have an entry in {@link RoleDefaults}; the table is built with an
 * exhaustive switch, so a new constant without a template does not compile.
 */
public enum FirmRole {

    OWNER("owner"),
    ADMIN("admin"),
    PARTNER("partner"),
    LAWYER("lawyer"),
    PARALEGAL("paralegal"),
    SECRETARY("secretary"),
    ACCOUNTANT("accountant"),
    DEPARTED("departed"),
    SOLO("solo");

    private final String value;

    FirmRole(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "paralegal"). */
    public String value() {
        return value;
    }

    /**
     * Whether this role administers the firm (member management, resource grants).
     */
    public boolean isFirmAdministrator() {
        return this == OWNER || this == ADMIN;
    }

    /**
     * Looks up a role by its canonical string value.
     *
     * @param value the string to match (case-sensitive)
     * @return the matching role, or empty if not found
     */
    public static Optional<FirmRole> fromString(String value) {
        for (FirmRole role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
