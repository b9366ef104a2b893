package com.lexguard.security;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The collections whose documents belong to a tenant. Operations on any other collection are
 * not checked by the {@link QueryIsolationEnforcer}.
 */
public final class TenantScopedCollections {

    /** Collections scoped by default. */
    public static final List<String> DEFAULTS = List.of(
            "cases", "clients", "invoices", "documents", "tasks", "time_entries", "calendar_events");

    private final Set<String> names;

    private TenantScopedCollections(Set<String> names) {
        this.names = names;
    }

    public static TenantScopedCollections defaults() {
        return of(DEFAULTS);
    }

    public static TenantScopedCollections of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("at least one tenant-scoped collection must be declared");
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("collection names must not be null or blank");
            }
        }
        return new TenantScopedCollections(Set.copyOf(names));
    }

    public boolean isTenantScoped(String collection) {
        return collection != null && names.contains(collection);
    }

    public Set<String> names() {
        return names;
    }
}
