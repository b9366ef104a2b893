package com.lexguard.security;

import com.lexguard.observability.RequestCorrelationHolder;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One structured security audit entry.
 *
 * @param eventId       unique event ID
 * @param timestamp     when the event happened
 * @param type          event kind
 * @param severity      event severity
 * @param correlationId correlation ID of the request (nullable for background jobs)
 * @param actor         user ID or system caller identity
 * @param scope         rendered scope predicate (nullable)
 * @param collection    collection or resource type involved (nullable)
 * @param detail        human-readable detail
 * @param attributes    extra structured data (redacted before it is written)
 */
public record SecurityAuditEvent(
        String eventId,
        Instant timestamp,
        AuditEventType type,
        AuditSeverity severity,
        String correlationId,
        String actor,
        String scope,
        String collection,
        String detail,
        Map<String, Object> attributes
) {

    public SecurityAuditEvent {
        attributes = attributes == null ? Map.of() : attributes;
    }

    /**
     * Creates an event stamped with a fresh ID, the current time and the bound correlation ID.
     */
    public static SecurityAuditEvent of(
            AuditEventType type,
            AuditSeverity severity,
            String actor,
            String scope,
            String collection,
            String detail,
            Map<String, Object> attributes) {
        return new SecurityAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                type,
                severity,
                RequestCorrelationHolder.currentCorrelationId(),
                actor,
                scope,
                collection,
                detail,
                attributes);
    }
}
