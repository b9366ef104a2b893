package com.lexguard.security;

/**
 * Composite key of a resource grant.
 *
 * @param resourceType resource type, e.g. "cases"
 * @param resourceId   the single resource
 * @param memberId     the grantee
 */
public record ResourceKey(String resourceType, String resourceId, String memberId) {

    public ResourceKey {
        if (resourceType == null || resourceType.isBlank()
                || resourceId == null || resourceId.isBlank()
                || memberId == null || memberId.isBlank()) {
            throw new IllegalArgumentException("resourceType, resourceId and memberId must not be null or blank");
        }
    }

    @Override
    public String toString() {
        return resourceType + "/" + resourceId + "@" + memberId;
    }
}
