package com.lexguard.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Membership status of a firm member.
 * <p>
 * Allowed transitions:
 * <ul>
 *   <li>{@code pending_approval -> active}</li>
 *   <li>{@code active <-> suspended}</li>
 *   <li>{@code active <-> departed} (rehire resets the role)</li>
 *   <li>{@code active <-> on_leave}</li>
 *   <li>any state {@code -> terminated}; terminated is a sink</li>
 * </ul>
 */
public enum MemberStatus {

    ACTIVE("active"),
    PENDING_APPROVAL("pending_approval"),
    SUSPENDED("suspended"),
    DEPARTED("departed"),
    ON_LEAVE("on_leave"),
    TERMINATED("terminated");

    private final String value;

    MemberStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Returns the statuses reachable from this one in a single transition.
     */
    public Set<MemberStatus> allowedTransitions() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(SUSPENDED, DEPARTED, ON_LEAVE, TERMINATED);
            case PENDING_APPROVAL -> EnumSet.of(ACTIVE, TERMINATED);
            case SUSPENDED, DEPARTED, ON_LEAVE -> EnumSet.of(ACTIVE, TERMINATED);
            case TERMINATED -> EnumSet.noneOf(MemberStatus.class);
        };
    }

    public boolean canTransitionTo(MemberStatus target) {
        return allowedTransitions().contains(target);
    }

    public static Optional<MemberStatus> fromString(String value) {
        for (MemberStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
