package com.lexguard.security;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Additional read restriction for departed members: only documents they own or are assigned
 * to, i.e. {@code ownerId == userId OR assigneeId == userId}.
 *
 * @param userId the departed member's user ID
 */
public record SelfScopeRestriction(String userId) {

    public SelfScopeRestriction {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    /** The restriction as a filter clause. */
    public Map<String, Object> asClause() {
        return Map.of(TenantKeys.OR, List.of(
                Map.of(TenantKeys.OWNER_ID, userId),
                Map.of(TenantKeys.ASSIGNEE_ID, userId)));
    }

    /** Whether a loaded document satisfies the restriction. */
    public boolean permits(Map<String, ?> document) {
        return Objects.equals(userId, document.get(TenantKeys.OWNER_ID))
                || Objects.equals(userId, document.get(TenantKeys.ASSIGNEE_ID));
    }
}
