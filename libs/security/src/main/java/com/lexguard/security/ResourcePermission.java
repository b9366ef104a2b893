package com.lexguard.security;

/**
 * A per-resource exception recorded on a member: access {@code level} to exactly one
 * resource.
 *
 * @param resourceType resource type, matching a {@link PracticeModule} wire value (e.g. "cases")
 * @param resourceId   identifier of the single resource
 * @param level        granted level
 */
public record ResourcePermission(String resourceType, String resourceId, AccessLevel level) {

    public ResourcePermission {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be null or blank");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
    }
}
