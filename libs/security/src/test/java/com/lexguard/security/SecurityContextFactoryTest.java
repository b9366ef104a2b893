package com.lexguard.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lexguard.observability.RequestCorrelation;
import com.lexguard.observability.RequestCorrelationHolder;
import com.lexguard.observability.SecurityMetrics;
import com.lexguard.observability.SecuritySpans;
import com.lexguard.security.testing.RecordingSecurityAuditLog;
import com.lexguard.security.testing.TestActors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextFactory")
class SecurityContextFactoryTest {

    private SimpleMeterRegistry registry;
    private SecurityContextFactory factory;

    @BeforeEach
    void setUp() {
        InMemoryMemberDirectory directory = new InMemoryMemberDirectory();
        directory.saveFirm(new Firm(TestActors.FIRM_ID, "Hale & Partners", SubscriptionTier.PROFESSIONAL));
        directory.save(TestActors.activeMember("u-1", FirmRole.PARTNER));

        RecordingSecurityAuditLog auditLog = new RecordingSecurityAuditLog();
        registry = new SimpleMeterRegistry();
        SecurityMetrics metrics = new SecurityMetrics(registry, "test");
        factory = new SecurityContextFactory(
                new TenantContextResolver(directory, auditLog),
                RoleDefaults.standard(),
                new QueryIsolationEnforcer(TenantScopedCollections.defaults(), metrics, auditLog),
                new InMemoryResourceGrantStore(),
                metrics,
                new SecuritySpans(OpenTelemetry.noop().getTracer("test")));
    }

    @AfterEach
    void tearDown() {
        RequestCorrelationHolder.clear();
    }

    @Test
    @DisplayName("resolves actor and permissions and binds them to the correlation")
    void createsContext() {
        RequestCorrelationHolder.set(RequestCorrelation.of("corr-42"));

        LexguardSecurityContext context = factory.create(ActorIdentity.member("u-1", TestActors.FIRM_ID));

        assertThat(context.correlationId()).isEqualTo("corr-42");
        assertThat(context.actor().role()).contains(FirmRole.PARTNER);
        assertThat(context.hasPermission(PracticeModule.CASES, AccessLevel.FULL)).isTrue();
        assertThat(RequestCorrelationHolder.get()).hasValueSatisfying(correlation -> {
            assertThat(correlation.userId()).isEqualTo("u-1");
            assertThat(correlation.scope()).isEqualTo("firm:" + TestActors.FIRM_ID);
        });
        assertThat(registry.get(SecurityMetrics.RESOLVE_TIMER).timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("works without a bound correlation")
    void withoutCorrelation() {
        LexguardSecurityContext context = factory.create(ActorIdentity.solo("L1"));

        assertThat(context.correlationId()).isNull();
        assertThat(context.scope()).isEqualTo(ScopePredicate.lawyer("L1"));
    }

    @Test
    @DisplayName("propagates resolution failures")
    void propagatesFailures() {
        assertThatThrownBy(() -> factory.create(ActorIdentity.member("ghost", TestActors.FIRM_ID)))
                .isInstanceOf(ActorNotProvisionedException.class);
    }
}
