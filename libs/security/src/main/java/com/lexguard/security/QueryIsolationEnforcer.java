package com.lexguard.security;

import com.lexguard.observability.SecurityMetrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single checkpoint every operation on a tenant-scoped collection passes through.
 * <p>
 * Reads fail closed: a filter without the actor's tenant key raises
 * {@link FirmIsolationViolationException}, a filter naming another tenant raises
 * {@link CrossTenantViolationException}. The missing predicate is never added on the caller's
 * behalf. Writes get the actor's tenant key injected into a copy of the payload. Departed
 * actors additionally get their self-scope clause appended to every read.
 * <p>
 * Every rejection increments the violation counter and writes a CRITICAL audit entry. Every
 * bypass is counted and audit-logged at WARN, both when it is opened and for each operation
 * issued through it.
 * <p>
 * Filters use the document-store operator form: field equality, {@code {field: {$eq: v}}},
 * {@code $or} and {@code $and} lists. A tenant key must be compared with a literal value (or
 * {@code $eq}); any other operator on a tenant key is treated as naming another tenant.
 */
public class QueryIsolationEnforcer {

    public static final String VIOLATION_FIRM_ISOLATION = "firm_isolation";
    public static final String VIOLATION_CROSS_TENANT = "cross_tenant";

    private static final Logger log = LoggerFactory.getLogger(QueryIsolationEnforcer.class);

    private final TenantScopedCollections collections;
    private final SecurityMetrics metrics;
    private final SecurityAuditLog auditLog;
    private final Clock clock;

    public QueryIsolationEnforcer(
            TenantScopedCollections collections,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog) {
        this(collections, metrics, auditLog, Clock.systemUTC());
    }

    public QueryIsolationEnforcer(
            TenantScopedCollections collections,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog,
            Clock clock) {
        if (collections == null || metrics == null || auditLog == null || clock == null) {
            throw new IllegalArgumentException("collections, metrics, auditLog and clock must not be null");
        }
        this.collections = collections;
        this.metrics = metrics;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public TenantScopedCollections collections() {
        return collections;
    }

    // ---- reads ----

    /**
     * Validates a read filter against the actor's scope and returns the filter to execute.
     * <p>
     * The returned map is a copy. For departed actors it carries the self-scope clause; for
     * solo practitioners it additionally excludes firm-owned documents.
     *
     * @throws FirmIsolationViolationException if the filter lacks the actor's tenant key
     * @throws CrossTenantViolationException   if the filter names another tenant
     */
    public Map<String, Object> scopedQuery(ActorContext actor, String collection, Map<String, ?> filter) {
        requireActor(actor, collection);
        Map<String, Object> query = filter == null ? new LinkedHashMap<>() : new LinkedHashMap<>(filter);
        if (!collections.isTenantScoped(collection)) {
            return query;
        }
        ScopePredicate expected = actor.scope();

        Optional<String> foreign = findForeignReference(expected, query);
        if (foreign.isPresent()) {
            throw reject(actor, collection, query, VIOLATION_CROSS_TENANT,
                    new CrossTenantViolationException(collection, expected, foreign.get()));
        }
        if (query.get(expected.tenantKey()) == null) {
            throw reject(actor, collection, query, VIOLATION_FIRM_ISOLATION,
                    new FirmIsolationViolationException(collection, expected));
        }

        if (expected instanceof ScopePredicate.LawyerScope) {
            query.putIfAbsent(TenantKeys.FIRM_ID, null);
        }
        actor.selfScope().ifPresent(restriction -> appendClause(query, restriction.asClause()));
        return query;
    }

    /**
     * Passes a read filter through a bypass unchanged (as a copy). Audit-logged at WARN.
     *
     * @throws IllegalStateException if the bypass has already been closed
     */
    public Map<String, Object> scopedQuery(SystemContext system, String collection, Map<String, ?> filter) {
        requireActive(system);
        Map<String, Object> query = filter == null ? new LinkedHashMap<>() : new LinkedHashMap<>(filter);
        if (collections.isTenantScoped(collection)) {
            auditBypassOperation(system, collection, "read", query);
        }
        return query;
    }

    // ---- writes ----

    /**
     * Returns a copy of the document carrying the actor's tenant key.
     * <p>
     * An absent key is injected. A key already set to the actor's tenant is kept. Solo
     * practitioner documents never carry a firm ID.
     *
     * @throws CrossTenantViolationException if the payload names another tenant
     */
    public Map<String, Object> scopedDocument(ActorContext actor, String collection, Map<String, ?> document) {
        requireActor(actor, collection);
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        Map<String, Object> scoped = new LinkedHashMap<>(document);
        if (!collections.isTenantScoped(collection)) {
            return scoped;
        }
        ScopePredicate expected = actor.scope();

        if (expected instanceof ScopePredicate.LawyerScope) {
            Object firmId = scoped.get(TenantKeys.FIRM_ID);
            if (firmId != null) {
                throw reject(actor, collection, scoped, VIOLATION_CROSS_TENANT,
                        new CrossTenantViolationException(collection, expected, "firm:" + firmId));
            }
            scoped.remove(TenantKeys.FIRM_ID);
        }
        Object current = scoped.get(expected.tenantKey());
        if (current != null && !expected.tenantValue().equals(current)) {
            throw reject(actor, collection, scoped, VIOLATION_CROSS_TENANT,
                    new CrossTenantViolationException(collection, expected, render(expected.tenantKey(), current)));
        }
        scoped.put(expected.tenantKey(), expected.tenantValue());
        return scoped;
    }

    /**
     * Passes a document through a bypass. The document must already carry a tenant key.
     *
     * @throws IllegalArgumentException if the document carries no tenant key
     * @throws IllegalStateException    if the bypass has already been closed
     */
    public Map<String, Object> scopedDocument(SystemContext system, String collection, Map<String, ?> document) {
        requireActive(system);
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        Map<String, Object> scoped = new LinkedHashMap<>(document);
        if (collections.isTenantScoped(collection)) {
            if (scoped.get(TenantKeys.FIRM_ID) == null && scoped.get(TenantKeys.LAWYER_ID) == null) {
                throw new IllegalArgumentException(
                        "Document for tenant-scoped collection '%s' carries no tenant key".formatted(collection));
            }
            auditBypassOperation(system, collection, "write", scoped);
        }
        return scoped;
    }

    // ---- loaded documents ----

    /**
     * Checks that a document loaded from storage belongs to the actor.
     *
     * @throws CrossTenantViolationException if the document belongs to another tenant
     * @throws PermissionDeniedException     if a departed actor neither owns nor is assigned to it
     */
    public void verifyOwnership(ActorContext actor, String collection, Map<String, ?> document) {
        requireActor(actor, collection);
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        if (!collections.isTenantScoped(collection)) {
            return;
        }
        ScopePredicate expected = actor.scope();
        Object owner = document.get(expected.tenantKey());
        boolean foreignFirm = expected instanceof ScopePredicate.LawyerScope
                && document.get(TenantKeys.FIRM_ID) != null;
        if (!expected.tenantValue().equals(owner) || foreignFirm) {
            throw reject(actor, collection, Map.of(), VIOLATION_CROSS_TENANT,
                    new CrossTenantViolationException(collection, expected, describeOwner(document)));
        }
        Optional<SelfScopeRestriction> restriction = actor.selfScope();
        if (restriction.isPresent() && !restriction.get().permits(document)) {
            throw new PermissionDeniedException(
                    "Former members may only access %s they own or are assigned to".formatted(collection));
        }
    }

    // ---- bypass ----

    /**
     * Runs {@code work} with a {@link SystemContext}. The context is closed when {@code work}
     * returns or throws.
     *
     * @param callerIdentity the system caller, e.g. {@code migration:2024-06-backfill}
     * @param reason         why isolation is bypassed
     */
    public <T> T withBypass(String callerIdentity, String reason, Function<SystemContext, T> work) {
        if (callerIdentity == null || callerIdentity.isBlank()) {
            throw new IllegalArgumentException("callerIdentity must not be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be null or blank");
        }
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        SystemContext system = new SystemContext(callerIdentity, reason, clock.instant());
        metrics.recordBypass();
        log.warn("Tenant isolation bypass opened by {}: {}", callerIdentity, reason);
        auditLog.record(SecurityAuditEvent.of(
                AuditEventType.BYPASS_OPENED, AuditSeverity.WARN, callerIdentity, null, null,
                reason, Map.of("openedAt", system.openedAt().toString())));
        try {
            return work.apply(system);
        } finally {
            system.close();
        }
    }

    // ---- internals ----

    private void requireActor(ActorContext actor, String collection) {
        if (actor == null) {
            throw new IllegalArgumentException("actor must not be null");
        }
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be null or blank");
        }
    }

    private static void requireActive(SystemContext system) {
        if (system == null) {
            throw new IllegalArgumentException("system context must not be null");
        }
        if (!system.isActive()) {
            throw new IllegalStateException("Bypass opened by %s is closed".formatted(system.callerIdentity()));
        }
    }

    private TenantSecurityException reject(
            ActorContext actor,
            String collection,
            Map<String, ?> payload,
            String violationType,
            TenantSecurityException violation) {
        long total = metrics.recordViolation(violationType);
        AuditEventType type = VIOLATION_FIRM_ISOLATION.equals(violationType)
                ? AuditEventType.FIRM_ISOLATION_VIOLATION
                : AuditEventType.CROSS_TENANT_VIOLATION;
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("payload", payload);
        attributes.put("violationCount", total);
        auditLog.record(SecurityAuditEvent.of(
                type, AuditSeverity.CRITICAL, actor.userId(), actor.scope().render(), collection,
                violation.getMessage(), attributes));
        return violation;
    }

    private void auditBypassOperation(SystemContext system, String collection, String operation, Map<String, ?> payload) {
        log.warn("Bypass {} on '{}' by {}", operation, collection, system.callerIdentity());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("operation", operation);
        attributes.put("reason", system.reason());
        attributes.put("payload", payload);
        auditLog.record(SecurityAuditEvent.of(
                AuditEventType.BYPASS_OPERATION, AuditSeverity.WARN, system.callerIdentity(), null, collection,
                "%s through bypass".formatted(operation), attributes));
    }

    /**
     * Walks the filter, including nested {@code $or}/{@code $and} clauses, and returns the
     * first reference to a tenant other than {@code expected}.
     */
    private static Optional<String> findForeignReference(ScopePredicate expected, Map<?, ?> node) {
        for (Map.Entry<?, ?> entry : node.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                return Optional.of("non-string key " + entry.getKey());
            }
            Object value = entry.getValue();
            if (TenantKeys.OR.equals(key) || TenantKeys.AND.equals(key)) {
                Optional<String> nested = findForeignReferenceIn(expected, value);
                if (nested.isPresent()) {
                    return nested;
                }
            } else if (key.equals(expected.tenantKey())) {
                if (value != null && literal(value).filter(expected.tenantValue()::equals).isEmpty()) {
                    return Optional.of(render(key, value));
                }
            } else if (expected instanceof ScopePredicate.LawyerScope && TenantKeys.FIRM_ID.equals(key)
                    && value != null) {
                return Optional.of(render(key, value));
            }
        }
        if (node.containsKey(expected.tenantKey()) && node.get(expected.tenantKey()) == null) {
            return Optional.of(expected.tenantKey() + ":null");
        }
        return Optional.empty();
    }

    private static Optional<String> findForeignReferenceIn(ScopePredicate expected, Object clauses) {
        if (!(clauses instanceof Collection<?> list)) {
            return Optional.of("malformed clause list " + clauses);
        }
        for (Object clause : list) {
            if (clause instanceof Map<?, ?> map) {
                Optional<String> found = findForeignReference(expected, map);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /** The literal a tenant key is compared with: a plain string or {@code {$eq: string}}. */
    private static Optional<String> literal(Object value) {
        if (value instanceof String text) {
            return Optional.of(text);
        }
        if (value instanceof Map<?, ?> operator && operator.size() == 1
                && operator.get(TenantKeys.EQ) instanceof String text) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    private static String render(String key, Object value) {
        Optional<String> literal = literal(value);
        if (literal.isEmpty()) {
            return key + " " + value;
        }
        return (TenantKeys.FIRM_ID.equals(key) ? "firm:" : "lawyer:") + literal.get();
    }

    private static String describeOwner(Map<String, ?> document) {
        Object firmId = document.get(TenantKeys.FIRM_ID);
        if (firmId != null) {
            return render(TenantKeys.FIRM_ID, firmId);
        }
        Object lawyerId = document.get(TenantKeys.LAWYER_ID);
        return lawyerId != null ? render(TenantKeys.LAWYER_ID, lawyerId) : "no tenant";
    }

    /** ANDs {@code clause} into {@code query}, wrapping an existing {@code $or} if needed. */
    private static void appendClause(Map<String, Object> query, Map<String, Object> clause) {
        boolean collides = clause.keySet().stream().anyMatch(query::containsKey);
        if (!collides && !query.containsKey(TenantKeys.AND)) {
            query.putAll(clause);
            return;
        }
        List<Object> and = new ArrayList<>();
        Object existingAnd = query.remove(TenantKeys.AND);
        if (existingAnd instanceof Collection<?> list) {
            and.addAll(list);
        } else if (existingAnd != null) {
            and.add(existingAnd);
        }
        for (String key : clause.keySet()) {
            if (query.containsKey(key)) {
                Map<String, Object> moved = new LinkedHashMap<>();
                moved.put(key, query.remove(key));
                and.add(moved);
            }
        }
        and.add(clause);
        query.put(TenantKeys.AND, and);
    }
}
