package com.lexguard.security;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * {@link ResourceGrantStore} backed by a {@link ConcurrentHashMap}. Per-key writes run inside
 * {@code compute}, which the map executes atomically for that key, so concurrent writers to
 * one key are serialized while different keys proceed in parallel.
 * <p>
 * A revoke leaves a tombstone carrying the last version of the key, so a stale writer holding
 * a version from before the revoke is rejected even after the grant has been re-created.
 */
public class InMemoryResourceGrantStore implements ResourceGrantStore {

    private static final long ANY_VERSION = -1L;

    /** Live grant, or a tombstone ({@code grant == null}) remembering the last version. */
    private record Slot(ResourceGrant grant, long lastVersion) {

        long currentVersion() {
            return grant != null ? grant.version() : ABSENT;
        }
    }

    private final ConcurrentMap<ResourceKey, Slot> slots = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResourceGrantStore() {
        this(Clock.systemUTC());
    }

    public InMemoryResourceGrantStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ResourceGrant> find(ResourceKey key) {
        return Optional.ofNullable(slots.get(key)).map(Slot::grant);
    }

    @Override
    public ResourceGrant put(ResourceKey key, AccessLevel level, String grantedBy) {
        return write(key, level, grantedBy, ANY_VERSION);
    }

    @Override
    public ResourceGrant put(ResourceKey key, AccessLevel level, String grantedBy, long expectedVersion) {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must not be negative");
        }
        return write(key, level, grantedBy, expectedVersion);
    }

    @Override
    public Optional<ResourceGrant> revoke(ResourceKey key) {
        return remove(key, ANY_VERSION);
    }

    @Override
    public Optional<ResourceGrant> revoke(ResourceKey key, long expectedVersion) {
        return remove(key, expectedVersion);
    }

    @Override
    public List<ResourceGrant> findByMember(String memberId) {
        return live(grant -> grant.key().memberId().equals(memberId)).stream()
                .sorted(Comparator.comparing(grant -> grant.key().toString()))
                .toList();
    }

    @Override
    public List<ResourceGrant> findByResource(String resourceType, String resourceId) {
        return live(grant -> grant.key().resourceType().equals(resourceType)
                        && grant.key().resourceId().equals(resourceId)).stream()
                .sorted(Comparator.comparing(grant -> grant.key().memberId()))
                .toList();
    }

    /** Number of live grants. */
    public int size() {
        return live(grant -> true).size();
    }

    private List<ResourceGrant> live(Predicate<ResourceGrant> filter) {
        return slots.values().stream()
                .map(Slot::grant)
                .filter(Objects::nonNull)
                .filter(filter)
                .toList();
    }

    private ResourceGrant write(ResourceKey key, AccessLevel level, String grantedBy, long expectedVersion) {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        Slot written = slots.compute(key, (k, slot) -> {
            long actual = slot == null ? ABSENT : slot.currentVersion();
            if (expectedVersion != ANY_VERSION && actual != expectedVersion) {
                throw new ConcurrentGrantModificationException(k, expectedVersion, actual);
            }
            long next = (slot == null ? ABSENT : slot.lastVersion()) + 1;
            return new Slot(new ResourceGrant(k, level, next, grantedBy, clock.instant()), next);
        });
        return written.grant();
    }

    private Optional<ResourceGrant> remove(ResourceKey key, long expectedVersion) {
        AtomicReference<ResourceGrant> removed = new AtomicReference<>();
        slots.compute(key, (k, slot) -> {
            long actual = slot == null ? ABSENT : slot.currentVersion();
            if (expectedVersion != ANY_VERSION && actual != expectedVersion) {
                throw new ConcurrentGrantModificationException(k, expectedVersion, actual);
            }
            if (slot == null) {
                return null;
            }
            removed.set(slot.grant());
            return new Slot(null, slot.lastVersion());
        });
        return Optional.ofNullable(removed.get());
    }
}
