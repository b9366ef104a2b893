package com.lexguard.security;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of per-resource grants.
 * <p>
 * Reads may run concurrently. Writes to the same key are serialized by the implementation;
 * the conditional variants additionally check the caller's expected version so that two
 * administrators editing the same grant cannot silently overwrite each other. Versions of a
 * key are never reused: a grant re-created after a revoke continues the key's version sequence.
 */
public interface ResourceGrantStore {

    /** Version to pass when the grant must not exist yet. */
    long ABSENT = 0L;

    Optional<ResourceGrant> find(ResourceKey key);

    default Optional<AccessLevel> levelFor(ResourceKey key) {
        return find(key).map(ResourceGrant::level);
    }

    /**
     * Creates or replaces the grant unconditionally.
     */
    ResourceGrant put(ResourceKey key, AccessLevel level, String grantedBy);

    /**
     * Creates or replaces the grant if its current version equals {@code expectedVersion}
     * ({@link #ABSENT} when it must not exist).
     *
     * @throws ConcurrentGrantModificationException on version mismatch
     */
    ResourceGrant put(ResourceKey key, AccessLevel level, String grantedBy, long expectedVersion);

    /**
     * Removes the grant.
     *
     * @return the removed grant, or empty if none existed
     */
    Optional<ResourceGrant> revoke(ResourceKey key);

    /**
     * Removes the grant if its current version equals {@code expectedVersion}.
     *
     * @throws ConcurrentGrantModificationException on version mismatch
     */
    Optional<ResourceGrant> revoke(ResourceKey key, long expectedVersion);

    List<ResourceGrant> findByMember(String memberId);

    List<ResourceGrant> findByResource(String resourceType, String resourceId);

    /**
     * Imports the grants recorded on a member snapshot, e.g. when the member is provisioned.
     */
    default void importMember(Member member) {
        for (ResourcePermission permission : member.resourcePermissions()) {
            put(new ResourceKey(permission.resourceType(), permission.resourceId(), member.id()),
                    permission.level(), "provisioning");
        }
    }
}
