package com.lexguard.observability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces log-safe copies of query filters and document payloads before they are attached
 * to audit entries.
 * <p>
 * Keys matching a sensitive pattern (case-insensitive substring) have their value replaced by
 * {@value #REDACTED}. Nested maps and collections are walked recursively. String values longer
 * than {@link #maxValueLength()} are truncated.
 */
public final class AuditRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential",
            "nationalid", "iban", "bankaccount", "ssn", "passport"
    );

    private static final int DEFAULT_MAX_VALUE_LENGTH = 256;

    private final Pattern sensitiveKeys;
    private final int maxValueLength;

    public AuditRedactor() {
        this(DEFAULT_PATTERNS, DEFAULT_MAX_VALUE_LENGTH);
    }

    /**
     * @param patterns       key substrings treated as sensitive
     * @param maxValueLength strings longer than this are truncated
     */
    public AuditRedactor(Set<String> patterns, int maxValueLength) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        if (maxValueLength < 8) {
            throw new IllegalArgumentException("maxValueLength must be at least 8");
        }
        String regex = String.join("|", patterns.stream().map(Pattern::quote).toList());
        this.sensitiveKeys = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.maxValueLength = maxValueLength;
    }

    /**
     * Returns a redacted deep copy of the given map. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            if (isSensitive(entry.getKey())) {
                result.put(entry.getKey(), REDACTED);
            } else {
                result.put(entry.getKey(), redactValue(entry.getValue()));
            }
        }
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && sensitiveKeys.matcher(key).find();
    }

    public int maxValueLength() {
        return maxValueLength;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        if (value instanceof String text && text.length() > maxValueLength) {
            return text.substring(0, maxValueLength) + "...";
        }
        return value;
    }
}
