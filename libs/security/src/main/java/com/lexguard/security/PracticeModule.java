package com.lexguard.security;

import java.util.Map;
import java.util.Optional;

/**
 * Functional areas of the practice platform that carry a module-level permission.
 * <p>
 * Per-resource checks measure a resource against the module that owns its collection, see
 * {@link #forResourceType(String)}. A module's wire value is itself a resource type, so
 * {@code cases} maps to {@link #CASES}; collections named differently from their module are
 * listed explicitly.
 */
public enum PracticeModule {

    CASES("cases"),
    CLIENTS("clients"),
    FINANCE("finance"),
    HR("hr"),
    REPORTS("reports"),
    DOCUMENTS("documents"),
    TASKS("tasks"),
    CALENDAR("calendar"),
    TIME_TRACKING("time_tracking"),
    SETTINGS("settings"),
    TEAM("team");

    private static final Map<String, PracticeModule> COLLECTION_MODULES = Map.of(
            "invoices", FINANCE,
            "time_entries", TIME_TRACKING,
            "calendar_events", CALENDAR);

    private final String value;

    PracticeModule(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PracticeModule> fromString(String value) {
        for (PracticeModule module : values()) {
            if (module.value.equals(value)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    /**
     * The module whose level is the baseline for resources of {@code resourceType}. Empty for a
     * type no module owns; such resources cannot carry grants.
     */
    public static Optional<PracticeModule> forResourceType(String resourceType) {
        PracticeModule mapped = resourceType == null ? null : COLLECTION_MODULES.get(resourceType);
        return mapped != null ? Optional.of(mapped) : fromString(resourceType);
    }
}
