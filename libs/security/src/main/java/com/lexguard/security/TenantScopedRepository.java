package com.lexguard.security;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data-access boundary of one tenant-scoped collection.
 * <p>
 * Every method takes the caller's {@link ActorContext} (or a {@link SystemContext}), so a call
 * site cannot reach the store without a scope: the filter or payload goes through the
 * {@link QueryIsolationEnforcer} before the store sees it, and documents loaded by ID are
 * checked for ownership before they are returned.
 */
public class TenantScopedRepository {

    private final String collection;
    private final DocumentStore store;
    private final QueryIsolationEnforcer enforcer;

    public TenantScopedRepository(String collection, DocumentStore store, QueryIsolationEnforcer enforcer) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be null or blank");
        }
        if (store == null || enforcer == null) {
            throw new IllegalArgumentException("store and enforcer must not be null");
        }
        if (!enforcer.collections().isTenantScoped(collection)) {
            throw new IllegalArgumentException("'%s' is not a tenant-scoped collection".formatted(collection));
        }
        this.collection = collection;
        this.store = store;
        this.enforcer = enforcer;
    }

    public String collection() {
        return collection;
    }

    public List<Map<String, Object>> find(ActorContext actor, Map<String, ?> filter) {
        return store.find(collection, enforcer.scopedQuery(actor, collection, filter));
    }

    /**
     * Loads a document by ID.
     *
     * @return the document, or empty if it does not exist
     * @throws CrossTenantViolationException if it exists but belongs to another tenant
     */
    public Optional<Map<String, Object>> findById(ActorContext actor, String id) {
        Optional<Map<String, Object>> document = store.findById(collection, id);
        document.ifPresent(found -> enforcer.verifyOwnership(actor, collection, found));
        return document;
    }

    public Map<String, Object> create(ActorContext actor, Map<String, ?> document) {
        return store.insert(collection, enforcer.scopedDocument(actor, collection, document));
    }

    public List<Map<String, Object>> find(SystemContext system, Map<String, ?> filter) {
        return store.find(collection, enforcer.scopedQuery(system, collection, filter));
    }

    public Map<String, Object> create(SystemContext system, Map<String, ?> document) {
        return store.insert(collection, enforcer.scopedDocument(system, collection, document));
    }
}
