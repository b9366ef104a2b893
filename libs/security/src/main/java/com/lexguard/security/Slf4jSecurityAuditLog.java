package com.lexguard.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lexguard.observability.AuditRedactor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Writes audit entries as single-line JSON to the {@value #LOGGER_NAME} logger.
 * <p>
 * CRITICAL entries are logged at ERROR with the {@code CRITICAL} marker so log routing can
 * alert on them; WARN and INFO entries map to the matching level. Attributes pass through the
 * {@link AuditRedactor} before serialization.
 */
public class Slf4jSecurityAuditLog implements SecurityAuditLog {

    public static final String LOGGER_NAME = "LEXGUARD_SECURITY_AUDIT";
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper mapper;
    private final AuditRedactor redactor;

    public Slf4jSecurityAuditLog(AuditRedactor redactor) {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS), redactor);
    }

    public Slf4jSecurityAuditLog(ObjectMapper mapper, AuditRedactor redactor) {
        if (mapper == null || redactor == null) {
            throw new IllegalArgumentException("mapper and redactor must not be null");
        }
        this.mapper = mapper;
        this.redactor = redactor;
    }

    @Override
    public void record(SecurityAuditEvent event) {
        String line;
        try {
            line = mapper.writeValueAsString(toStructuredLog(event));
        } catch (JsonProcessingException e) {
            AUDIT.error("Failed to serialize audit event {}: {}", event.eventId(), e.getOriginalMessage());
            line = "type=%s actor=%s scope=%s collection=%s detail=%s".formatted(
                    event.type(), event.actor(), event.scope(), event.collection(), event.detail());
        }
        switch (event.severity()) {
            case CRITICAL -> AUDIT.error(CRITICAL, line);
            case WARN -> AUDIT.warn(line);
            case INFO -> AUDIT.info(line);
        }
    }

    /**
     * The map serialized for an event. Package-private for testing.
     */
    Map<String, Object> toStructuredLog(SecurityAuditEvent event) {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("eventId", event.eventId());
        log.put("timestamp", event.timestamp());
        log.put("type", event.type());
        log.put("severity", event.severity());
        log.put("correlationId", event.correlationId());
        log.put("actor", event.actor());
        log.put("scope", event.scope());
        log.put("collection", event.collection());
        log.put("detail", event.detail());
        log.put("attributes", redactor.redact(event.attributes()));
        return log;
    }
}
