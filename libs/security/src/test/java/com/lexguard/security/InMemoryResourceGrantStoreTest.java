package com.lexguard.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryResourceGrantStore")
class InMemoryResourceGrantStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");
    private static final ResourceKey CASE_123 = new ResourceKey("cases", "CASE123", "member-p1");

    private InMemoryResourceGrantStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryResourceGrantStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("put and find")
    class PutAndFind {

        @Test
        @DisplayName("stores a grant at version 1 and looks it up by key")
        void storesGrant() {
            ResourceGrant grant = store.put(CASE_123, AccessLevel.EDIT, "owner-1");

            assertThat(grant.version()).isEqualTo(1);
            assertThat(grant.grantedAt()).isEqualTo(NOW);
            assertThat(store.find(CASE_123)).contains(grant);
            assertThat(store.levelFor(CASE_123)).contains(AccessLevel.EDIT);
            assertThat(store.levelFor(new ResourceKey("cases", "CASE456", "member-p1"))).isEmpty();
        }

        @Test
        @DisplayName("replacing a grant bumps its version")
        void bumpsVersion() {
            store.put(CASE_123, AccessLevel.VIEW, "owner-1");
            ResourceGrant replaced = store.put(CASE_123, AccessLevel.FULL, "admin-1");

            assertThat(replaced.version()).isEqualTo(2);
            assertThat(replaced.grantedBy()).isEqualTo("admin-1");
        }

        @Test
        @DisplayName("lists by member and by resource")
        void lists() {
            store.put(CASE_123, AccessLevel.EDIT, "owner-1");
            store.put(new ResourceKey("cases", "CASE123", "member-p2"), AccessLevel.VIEW, "owner-1");
            store.put(new ResourceKey("documents", "DOC1", "member-p1"), AccessLevel.FULL, "owner-1");

            assertThat(store.findByMember("member-p1")).hasSize(2);
            assertThat(store.findByResource("cases", "CASE123"))
                    .extracting(grant -> grant.key().memberId())
                    .containsExactly("member-p1", "member-p2");
        }

        @Test
        @DisplayName("imports the grants recorded on a member")
        void importsMember() {
            Member member = new Member("member-p1", "firm-001", "p1", FirmRole.PARALEGAL, MemberStatus.ACTIVE)
                    .withResourcePermissions(List.of(
                            new ResourcePermission("cases", "CASE123", AccessLevel.EDIT),
                            new ResourcePermission("clients", "CL9", AccessLevel.VIEW)));

            store.importMember(member);

            assertThat(store.levelFor(CASE_123)).contains(AccessLevel.EDIT);
            assertThat(store.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("optimistic versions")
    class Versions {

        @Test
        @DisplayName("a conditional create fails when the grant already exists")
        void createConflict() {
            store.put(CASE_123, AccessLevel.VIEW, "owner-1");

            assertThatThrownBy(() -> store.put(CASE_123, AccessLevel.EDIT, "admin-1", ResourceGrantStore.ABSENT))
                    .isInstanceOf(ConcurrentGrantModificationException.class)
                    .satisfies(e -> {
                        ConcurrentGrantModificationException conflict = (ConcurrentGrantModificationException) e;
                        assertThat(conflict.expectedVersion()).isZero();
                        assertThat(conflict.actualVersion()).isEqualTo(1);
                        assertThat(conflict.isRetryable()).isTrue();
                    });
            assertThat(store.levelFor(CASE_123)).contains(AccessLevel.VIEW);
        }

        @Test
        @DisplayName("a conditional update succeeds on the current version")
        void updateCurrent() {
            ResourceGrant first = store.put(CASE_123, AccessLevel.VIEW, "owner-1", ResourceGrantStore.ABSENT);

            ResourceGrant second = store.put(CASE_123, AccessLevel.EDIT, "owner-1", first.version());

            assertThat(second.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("a conditional revoke on a stale version leaves the grant in place")
        void staleRevoke() {
            store.put(CASE_123, AccessLevel.VIEW, "owner-1");
            store.put(CASE_123, AccessLevel.EDIT, "owner-1");

            assertThatThrownBy(() -> store.revoke(CASE_123, 1))
                    .isInstanceOf(ConcurrentGrantModificationException.class);
            assertThat(store.find(CASE_123)).isPresent();
            assertThat(store.revoke(CASE_123, 2)).map(ResourceGrant::level).contains(AccessLevel.EDIT);
            assertThat(store.find(CASE_123)).isEmpty();
        }

        @Test
        @DisplayName("a grant re-created after a revoke does not reuse the revoked version")
        void staleWriteAfterRecreate() {
            ResourceGrant original = store.put(CASE_123, AccessLevel.VIEW, "owner-1", ResourceGrantStore.ABSENT);
            store.revoke(CASE_123, original.version());

            ResourceGrant recreated = store.put(CASE_123, AccessLevel.FULL, "admin-1", ResourceGrantStore.ABSENT);

            assertThat(recreated.version()).isEqualTo(2);
            assertThatThrownBy(() -> store.put(CASE_123, AccessLevel.VIEW, "owner-1", original.version()))
                    .isInstanceOf(ConcurrentGrantModificationException.class)
                    .satisfies(e -> assertThat(((ConcurrentGrantModificationException) e).actualVersion())
                            .isEqualTo(2));
            assertThat(store.levelFor(CASE_123)).contains(AccessLevel.FULL);
        }

        @Test
        @DisplayName("a revoked key reads as absent and is not counted")
        void revokedKeyIsAbsent() {
            store.put(CASE_123, AccessLevel.VIEW, "owner-1");
            store.revoke(CASE_123);

            assertThat(store.find(CASE_123)).isEmpty();
            assertThat(store.findByMember("member-p1")).isEmpty();
            assertThat(store.size()).isZero();
            assertThat(store.revoke(CASE_123)).isEmpty();
            assertThatThrownBy(() -> store.revoke(CASE_123, 1))
                    .isInstanceOf(ConcurrentGrantModificationException.class);
        }

        @Test
        @DisplayName("rejects negative expected versions")
        void negativeVersion() {
            assertThatThrownBy(() -> store.put(CASE_123, AccessLevel.VIEW, "owner-1", -3))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent unconditional writes to one key lose no version")
        void noLostUpdates() throws Exception {
            int writers = 8;
            int writesEach = 200;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    String admin = "admin-" + w;
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < writesEach; i++) {
                            store.put(CASE_123, AccessLevel.EDIT, admin);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(store.find(CASE_123)).map(ResourceGrant::version).contains((long) writers * writesEach);
        }

        @Test
        @DisplayName("of two admins editing the same version exactly one wins")
        void oneWinner() throws Exception {
            ResourceGrant base = store.put(CASE_123, AccessLevel.VIEW, "owner-1");
            int contenders = 6;
            ExecutorService pool = Executors.newFixedThreadPool(contenders);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger wins = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int c = 0; c < contenders; c++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            store.put(CASE_123, AccessLevel.FULL, "admin", base.version());
                            wins.incrementAndGet();
                        } catch (ConcurrentGrantModificationException e) {
                            conflicts.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(wins.get()).isEqualTo(1);
            assertThat(conflicts.get()).isEqualTo(contenders - 1);
            assertThat(store.find(CASE_123)).map(ResourceGrant::version).contains(2L);
        }
    }

    @Test
    @DisplayName("keys reject blank parts")
    void keyValidation() {
        assertThatThrownBy(() -> new ResourceKey("cases", " ", "m-1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Map.of(CASE_123, 1)).containsKey(new ResourceKey("cases", "CASE123", "member-p1"));
    }
}
