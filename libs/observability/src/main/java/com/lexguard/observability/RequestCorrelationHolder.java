package com.lexguard.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for the current {@link RequestCorrelation} with an SLF4J MDC bridge.
 * <p>
 * The security core runs inline on the request thread, so a thread-local is sufficient.
 * Work handed to another thread must carry the correlation explicitly through
 * {@link #callWithCorrelation(RequestCorrelation, Supplier)}.
 */
public final class RequestCorrelationHolder {

    private static final ThreadLocal<RequestCorrelation> CURRENT = new ThreadLocal<>();

    private RequestCorrelationHolder() {
        // utility class
    }

    /**
     * Binds the correlation to the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if correlation is null
     */
    public static void set(RequestCorrelation correlation) {
        if (correlation == null) {
            throw new IllegalArgumentException("correlation must not be null");
        }
        CURRENT.set(correlation);
        putOrRemove(RequestCorrelation.MDC_CORRELATION_ID, correlation.correlationId());
        putOrRemove(RequestCorrelation.MDC_REQUEST_ID, correlation.requestId());
        putOrRemove(RequestCorrelation.MDC_USER_ID, correlation.userId());
        putOrRemove(RequestCorrelation.MDC_SCOPE, correlation.scope());
    }

    public static Optional<RequestCorrelation> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Returns the current correlation ID, or {@code null} when none is bound.
     */
    public static String currentCorrelationId() {
        RequestCorrelation correlation = CURRENT.get();
        return correlation != null ? correlation.correlationId() : null;
    }

    /**
     * Enriches the bound correlation with the resolved actor. No-op when nothing is bound.
     */
    public static void bindActor(String userId, String scope) {
        RequestCorrelation correlation = CURRENT.get();
        if (correlation != null) {
            set(correlation.withActor(userId, scope));
        }
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(RequestCorrelation.MDC_CORRELATION_ID);
        MDC.remove(RequestCorrelation.MDC_REQUEST_ID);
        MDC.remove(RequestCorrelation.MDC_USER_ID);
        MDC.remove(RequestCorrelation.MDC_SCOPE);
    }

    /**
     * Runs the work with the given correlation bound, restoring whatever was bound before.
     *
     * @param correlation correlation for the duration of the call
     * @param work        the work to run
     * @param <T>         result type
     * @return the work's result
     */
    public static <T> T callWithCorrelation(RequestCorrelation correlation, Supplier<T> work) {
        RequestCorrelation previous = CURRENT.get();
        try {
            set(correlation);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
