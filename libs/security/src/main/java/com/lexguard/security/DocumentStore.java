package com.lexguard.security;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal document storage port. Filters use the operator form described on
 * {@link QueryIsolationEnforcer}. Implementations perform no tenant checks of their own; callers
 * reach them through a {@link TenantScopedRepository}.
 */
public interface DocumentStore {

    /** Field holding a document's identifier. */
    String ID = "id";

    List<Map<String, Object>> find(String collection, Map<String, Object> filter);

    Optional<Map<String, Object>> findById(String collection, String id);

    /**
     * Inserts the document, assigning an {@value #ID} when it has none.
     *
     * @return the stored document
     */
    Map<String, Object> insert(String collection, Map<String, Object> document);
}
