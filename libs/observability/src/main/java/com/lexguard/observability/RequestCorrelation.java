package com.lexguard.observability;

/**
 * Immutable correlation data for one inbound request.
 * <p>
 * Established once per request by the web or gRPC entry point, then enriched with the
 * resolved actor once the tenant context is known. Values are pushed into the SLF4J MDC
 * by {@link RequestCorrelationHolder} so that every log line, including the security
 * audit stream, can be joined back to the request that produced it.
 *
 * @param correlationId unique ID for the business flow, propagated from {@code X-Correlation-ID}
 * @param requestId     unique ID for this specific request (nullable)
 * @param userId        authenticated user performing the request (nullable before resolution)
 * @param scope         rendered tenant scope, e.g. {@code firm:F1} or {@code lawyer:L1} (nullable before resolution)
 */
public record RequestCorrelation(
        String correlationId,
        String requestId,
        String userId,
        String scope
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_SCOPE = "tenantScope";

    public RequestCorrelation {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a correlation carrying only the correlation ID, as known at the edge
     * before the actor has been resolved.
     */
    public static RequestCorrelation of(String correlationId) {
        return new RequestCorrelation(correlationId, null, null, null);
    }

    /**
     * Returns a copy enriched with the resolved actor.
     *
     * @param actorUserId the authenticated user ID
     * @param actorScope  the rendered scope predicate
     */
    public RequestCorrelation withActor(String actorUserId, String actorScope) {
        return new RequestCorrelation(correlationId, requestId, actorUserId, actorScope);
    }
}
