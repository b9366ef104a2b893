package com.lexguard.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lexguard.observability.SecurityMetrics;
import com.lexguard.security.testing.RecordingSecurityAuditLog;
import com.lexguard.security.testing.TestActors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueryIsolationEnforcer")
class QueryIsolationEnforcerTest {

    private static final String F1 = "F1";

    private SimpleMeterRegistry registry;
    private SecurityMetrics metrics;
    private RecordingSecurityAuditLog auditLog;
    private QueryIsolationEnforcer enforcer;

    private final ActorContext lawyer = TestActors.firmMember("u-1", F1, FirmRole.LAWYER);
    private final ActorContext solo = TestActors.solo("L1");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SecurityMetrics(registry, "test");
        auditLog = new RecordingSecurityAuditLog();
        enforcer = new QueryIsolationEnforcer(TenantScopedCollections.defaults(), metrics, auditLog);
    }

    @Nested
    @DisplayName("scopedQuery() for firm members")
    class FirmReads {

        @Test
        @DisplayName("passes a filter carrying the actor's firm")
        void matchingFirm() {
            Map<String, Object> query = enforcer.scopedQuery(lawyer, "cases", Map.of("firmId", F1, "status", "open"));

            assertThat(query).containsEntry("firmId", F1).containsEntry("status", "open").hasSize(2);
            assertThat(metrics.violationCount()).isZero();
        }

        @Test
        @DisplayName("accepts the $eq form of the tenant key")
        void eqOperator() {
            assertThat(enforcer.scopedQuery(lawyer, "cases", Map.of("firmId", Map.of("$eq", F1))))
                    .containsKey("firmId");
        }

        @Test
        @DisplayName("fails closed when the tenant key is missing")
        void missingPredicate() {
            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", Map.of("status", "open")))
                    .isInstanceOf(FirmIsolationViolationException.class)
                    .hasMessageContaining("cases")
                    .hasMessageContaining("firmId");
            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", null))
                    .isInstanceOf(FirmIsolationViolationException.class);
        }

        @Test
        @DisplayName("a lawyerId filter does not stand in for the firm predicate")
        void lawyerIdOnly() {
            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", Map.of("lawyerId", "u-1")))
                    .isInstanceOf(FirmIsolationViolationException.class);
        }

        @Test
        @DisplayName("raises CrossTenantViolation for another firm, logged CRITICAL")
        void otherFirm() {
            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "invoices", Map.of("firmId", "F2")))
                    .isInstanceOf(CrossTenantViolationException.class)
                    .satisfies(e -> {
                        CrossTenantViolationException violation = (CrossTenantViolationException) e;
                        assertThat(violation.expectedScope()).isEqualTo("firm:F1");
                        assertThat(violation.actualScope()).isEqualTo("firm:F2");
                        assertThat(violation.category()).isEqualTo(ErrorCategory.SECURITY_INCIDENT);
                    });

            assertThat(auditLog.ofType(AuditEventType.CROSS_TENANT_VIOLATION)).singleElement()
                    .satisfies(event -> {
                        assertThat(event.severity()).isEqualTo(AuditSeverity.CRITICAL);
                        assertThat(event.collection()).isEqualTo("invoices");
                        assertThat(event.scope()).isEqualTo("firm:F1");
                    });
            assertThat(registry.get(SecurityMetrics.VIOLATIONS)
                    .tag(SecurityMetrics.TAG_TYPE, QueryIsolationEnforcer.VIOLATION_CROSS_TENANT)
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("detects another firm hidden in a nested $or")
        void nestedOtherFirm() {
            Map<String, Object> filter = Map.of(
                    "firmId", F1,
                    "$or", List.of(Map.of("status", "open"), Map.of("firmId", "F2")));

            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", filter))
                    .isInstanceOf(CrossTenantViolationException.class);
        }

        @Test
        @DisplayName("treats a nested clause keyed by a non-string as cross-tenant")
        void nonStringKey() {
            Map<String, Object> filter = Map.of(
                    "firmId", F1,
                    "$or", List.of(Map.of("status", "open"), Map.of(42, "F2")));

            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", filter))
                    .isInstanceOf(CrossTenantViolationException.class);
            assertThat(metrics.violationCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("treats a non-equality operator on the tenant key as cross-tenant")
        void inOperator() {
            Map<String, Object> filter = Map.of("firmId", Map.of("$in", List.of(F1, "F2")));

            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", filter))
                    .isInstanceOf(CrossTenantViolationException.class);
        }

        @Test
        @DisplayName("treats a null firm predicate as cross-tenant")
        void nullFirm() {
            Map<String, Object> filter = new HashMap<>();
            filter.put("firmId", null);

            assertThatThrownBy(() -> enforcer.scopedQuery(lawyer, "cases", filter))
                    .isInstanceOf(CrossTenantViolationException.class);
        }

        @Test
        @DisplayName("leaves collections outside the tenant scope untouched")
        void unscopedCollection() {
            assertThat(enforcer.scopedQuery(lawyer, "jurisdictions", Map.of("country", "SA")))
                    .containsExactly(Map.entry("country", "SA"));
        }

        @Test
        @DisplayName("counts every violation monotonically")
        void monotonicCounter() {
            for (int i = 0; i < 3; i++) {
                try {
                    enforcer.scopedQuery(lawyer, "cases", Map.of());
                } catch (FirmIsolationViolationException expected) {
                    // counted
                }
            }
            assertThat(metrics.violationCount()).isEqualTo(3);
            assertThat(auditLog.ofType(AuditEventType.FIRM_ISOLATION_VIOLATION))
                    .extracting(event -> event.attributes().get("violationCount"))
                    .containsExactly(1L, 2L, 3L);
        }
    }

    @Nested
    @DisplayName("scopedQuery() for departed and solo actors")
    class RestrictedReads {

        @Test
        @DisplayName("appends the self-scope clause for departed members")
        void departedSelfScope() {
            ActorContext departed = TestActors.departed("u-1", F1);

            Map<String, Object> query = enforcer.scopedQuery(departed, "cases", Map.of("firmId", F1));

            assertThat(query).containsEntry("firmId", F1);
            assertThat(query).containsEntry("$or", List.of(Map.of("ownerId", "u-1"), Map.of("assigneeId", "u-1")));
        }

        @Test
        @DisplayName("wraps an existing $or so both must hold")
        void departedExistingOr() {
            ActorContext departed = TestActors.departed("u-1", F1);
            List<Map<String, Object>> statusOr = List.of(Map.of("status", "open"), Map.of("status", "pending"));

            Map<String, Object> query = enforcer.scopedQuery(departed, "cases", Map.of("firmId", F1, "$or", statusOr));

            assertThat(query).doesNotContainKey("$or");
            assertThat(query.get("$and")).asList().containsExactly(
                    Map.of("$or", statusOr),
                    new SelfScopeRestriction("u-1").asClause());
        }

        @Test
        @DisplayName("solo practitioners are scoped by lawyerId and excluded from firm documents")
        void soloScope() {
            Map<String, Object> query = enforcer.scopedQuery(solo, "cases", Map.of("lawyerId", "L1"));

            assertThat(query).containsEntry("lawyerId", "L1").containsEntry("firmId", null);
        }

        @Test
        @DisplayName("solo practitioners cannot name a firm")
        void soloNamingFirm() {
            assertThatThrownBy(() -> enforcer.scopedQuery(solo, "cases", Map.of("lawyerId", "L1", "firmId", F1)))
                    .isInstanceOf(CrossTenantViolationException.class);
        }

        @Test
        @DisplayName("solo practitioners cannot read another lawyer's documents")
        void soloOtherLawyer() {
            assertThatThrownBy(() -> enforcer.scopedQuery(solo, "clients", Map.of("lawyerId", "L2")))
                    .isInstanceOf(CrossTenantViolationException.class)
                    .hasMessageContaining("lawyer:L2");
        }
    }

    @Nested
    @DisplayName("scopedDocument()")
    class Writes {

        @Test
        @DisplayName("injects the firm into a payload without one")
        void injectsFirm() {
            Map<String, Object> input = Map.of("title", "Lease dispute");

            Map<String, Object> scoped = enforcer.scopedDocument(lawyer, "cases", input);

            assertThat(scoped).containsEntry("firmId", F1).containsEntry("title", "Lease dispute");
            assertThat(input).doesNotContainKey("firmId");
        }

        @Test
        @DisplayName("injects lawyerId and never a firmId for solo practitioners")
        void injectsLawyer() {
            Map<String, Object> input = new HashMap<>();
            input.put("title", "Will");
            input.put("firmId", null);

            Map<String, Object> scoped = enforcer.scopedDocument(solo, "cases", input);

            assertThat(scoped).containsEntry("lawyerId", "L1").doesNotContainKey("firmId");
        }

        @Test
        @DisplayName("keeps a payload already naming the actor's firm")
        void keepsMatchingFirm() {
            assertThat(enforcer.scopedDocument(lawyer, "tasks", Map.of("firmId", F1))).containsEntry("firmId", F1);
        }

        @Test
        @DisplayName("rejects a payload naming another tenant")
        void rejectsOtherTenant() {
            assertThatThrownBy(() -> enforcer.scopedDocument(lawyer, "tasks", Map.of("firmId", "F2")))
                    .isInstanceOf(CrossTenantViolationException.class);
            assertThatThrownBy(() -> enforcer.scopedDocument(solo, "tasks", Map.of("firmId", "F2")))
                    .isInstanceOf(CrossTenantViolationException.class);
            assertThat(metrics.violationCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("verifyOwnership()")
    class Ownership {

        @Test
        @DisplayName("passes documents of the actor's firm")
        void ownFirm() {
            enforcer.verifyOwnership(lawyer, "cases", Map.of("id", "c1", "firmId", F1));
            assertThat(metrics.violationCount()).isZero();
        }

        @Test
        @DisplayName("rejects documents of another firm")
        void otherFirm() {
            assertThatThrownBy(() -> enforcer.verifyOwnership(lawyer, "cases", Map.of("id", "c1", "firmId", "F2")))
                    .isInstanceOf(CrossTenantViolationException.class)
                    .hasMessageContaining("firm:F2");
        }

        @Test
        @DisplayName("rejects firm documents for solo practitioners even when lawyerId matches")
        void soloFirmDocument() {
            assertThatThrownBy(() -> enforcer.verifyOwnership(solo, "cases", Map.of("lawyerId", "L1", "firmId", F1)))
                    .isInstanceOf(CrossTenantViolationException.class);
        }

        @Test
        @DisplayName("denies departed members documents they neither own nor are assigned to")
        void departedOutsideSelfScope() {
            ActorContext departed = TestActors.departed("u-1", F1);

            enforcer.verifyOwnership(departed, "cases", Map.of("firmId", F1, "assigneeId", "u-1"));
            assertThatThrownBy(() -> enforcer.verifyOwnership(departed, "cases", Map.of("firmId", F1, "ownerId", "u-2")))
                    .isInstanceOf(PermissionDeniedException.class);
        }
    }

    @Nested
    @DisplayName("withBypass()")
    class Bypass {

        @Test
        @DisplayName("allows unscoped reads, counted and audit-logged at WARN")
        void unscopedRead() {
            Map<String, Object> query = enforcer.withBypass("migration:backfill", "backfill case numbers",
                    system -> enforcer.scopedQuery(system, "cases", Map.of("status", "open")));

            assertThat(query).containsExactly(Map.entry("status", "open"));
            assertThat(registry.get(SecurityMetrics.BYPASS).counter().count()).isEqualTo(1.0);
            assertThat(auditLog.ofType(AuditEventType.BYPASS_OPENED)).singleElement()
                    .satisfies(event -> assertThat(event.actor()).isEqualTo("migration:backfill"));
            assertThat(auditLog.ofType(AuditEventType.BYPASS_OPERATION)).singleElement()
                    .satisfies(event -> assertThat(event.severity()).isEqualTo(AuditSeverity.WARN));
            assertThat(metrics.violationCount()).isZero();
        }

        @Test
        @DisplayName("closes the system context when the callback returns")
        void closesContext() {
            AtomicReference<SystemContext> leaked = new AtomicReference<>();
            enforcer.withBypass("job:reindex", "reindex", system -> {
                leaked.set(system);
                return system.isActive();
            });

            assertThat(leaked.get().isActive()).isFalse();
            assertThatThrownBy(() -> enforcer.scopedQuery(leaked.get(), "cases", Map.of()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("requires a caller identity and reason")
        void requiresIdentity() {
            assertThatThrownBy(() -> enforcer.withBypass(" ", "x", system -> null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> enforcer.withBypass("job", null, system -> null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("writes through a bypass must carry a tenant key")
        void bypassWrite() {
            enforcer.withBypass("migration:import", "import", system -> {
                assertThat(enforcer.scopedDocument(system, "cases", Map.of("firmId", "F9"))).containsEntry("firmId", "F9");
                assertThatThrownBy(() -> enforcer.scopedDocument(system, "cases", Map.of("title", "x")))
                        .isInstanceOf(IllegalArgumentException.class);
                return null;
            });
        }
    }
}
