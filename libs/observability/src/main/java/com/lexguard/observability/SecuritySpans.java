package com.lexguard.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for the security core.
 * <p>
 * Spans are {@link SpanKind#INTERNAL} and carry the correlation attributes of the current
 * {@link RequestCorrelationHolder}. Work is expressed as a {@link Supplier}: the core performs
 * no checked I/O, so runtime exceptions are recorded on the span and rethrown unchanged.
 * SDK configuration (exporter, sampler) belongs to the hosting service.
 */
public final class SecuritySpans {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_USER_ID = "enduser.id";
    public static final String ATTR_SCOPE = "lexguard.scope";

    private final Tracer tracer;

    public SecuritySpans(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Runs the work inside a new span.
     *
     * @param spanName   span name
     * @param attributes extra string attributes
     * @param work       the work to run
     * @return the work's result
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        RequestCorrelationHolder.get().ifPresent(correlation -> {
            span.setAttribute(ATTR_CORRELATION_ID, correlation.correlationId());
            if (correlation.userId() != null) {
                span.setAttribute(ATTR_USER_ID, correlation.userId());
            }
            if (correlation.scope() != null) {
                span.setAttribute(ATTR_SCOPE, correlation.scope());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
