package com.lexguard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer meters for the tenant isolation core.
 * <p>
 * Every meter carries a {@code service} tag. Violations are additionally tagged with their
 * {@code type}; the untagged running total is exposed through {@link #violationCount()} and
 * as the function counter {@value #VIOLATIONS_TOTAL}, which only ever increases.
 */
public final class SecurityMetrics {

    public static final String VIOLATIONS = "lexguard.isolation.violations";
    public static final String VIOLATIONS_TOTAL = "lexguard.isolation.violations.total";
    public static final String BYPASS = "lexguard.isolation.bypass";
    public static final String RESOLVE_TIMER = "lexguard.permissions.resolve";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TYPE = "type";

    private final MeterRegistry registry;
    private final String serviceName;
    private final AtomicLong violationTotal = new AtomicLong();
    private final Map<String, Counter> violationCounters = new ConcurrentHashMap<>();
    private final Counter bypassCounter;
    private final Timer resolveTimer;

    /**
     * @param registry    the meter registry (e.g. Prometheus, or SimpleMeterRegistry in tests)
     * @param serviceName logical service name attached as the {@code service} tag
     */
    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.bypassCounter = Counter.builder(BYPASS)
                .description("Data operations issued through an explicit system bypass")
                .tags(serviceTags())
                .register(registry);
        this.resolveTimer = Timer.builder(RESOLVE_TIMER)
                .description("Time spent resolving the actor context and effective permissions")
                .tags(serviceTags())
                .register(registry);
        FunctionCounter.builder(VIOLATIONS_TOTAL, violationTotal, AtomicLong::doubleValue)
                .description("Total tenant isolation violations since start")
                .tags(serviceTags())
                .register(registry);
    }

    /**
     * Records one isolation violation of the given type.
     *
     * @param type violation type, e.g. {@code firm_isolation} or {@code cross_tenant}
     * @return the running total after this violation
     */
    public long recordViolation(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        violationCounters.computeIfAbsent(type, t -> Counter.builder(VIOLATIONS)
                        .description("Tenant isolation violations by type")
                        .tags(serviceTags().and(TAG_TYPE, t))
                        .register(registry))
                .increment();
        return violationTotal.incrementAndGet();
    }

    public void recordBypass() {
        bypassCounter.increment();
    }

    /**
     * Times a permission resolution.
     */
    public <T> T timeResolution(Supplier<T> resolution) {
        return resolveTimer.record(resolution);
    }

    /** Monotonically increasing number of violations recorded by this instance. */
    public long violationCount() {
        return violationTotal.get();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags serviceTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
