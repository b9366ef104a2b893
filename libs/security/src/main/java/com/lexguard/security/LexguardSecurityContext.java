package com.lexguard.security;

import java.util.Map;

/**
 * Per-request security surface handed to business logic: the resolved {@link ActorContext},
 * the permissions computed once for the request, and the scoping operations bound to that
 * actor.
 * <p>
 * Immutable apart from what the grant store returns; may be read from several threads serving
 * the same request.
 */
public final class LexguardSecurityContext {

    private final ActorContext actor;
    private final EffectivePermissionSet permissions;
    private final QueryIsolationEnforcer enforcer;
    private final ResourceGrantStore grantStore;
    private final String correlationId;

    public LexguardSecurityContext(
            ActorContext actor,
            EffectivePermissionSet permissions,
            QueryIsolationEnforcer enforcer,
            ResourceGrantStore grantStore,
            String correlationId) {
        if (actor == null || permissions == null || enforcer == null || grantStore == null) {
            throw new IllegalArgumentException("actor, permissions, enforcer and grantStore must not be null");
        }
        this.actor = actor;
        this.permissions = permissions;
        this.enforcer = enforcer;
        this.grantStore = grantStore;
        this.correlationId = correlationId;
    }

    public ActorContext actor() {
        return actor;
    }

    public EffectivePermissionSet permissions() {
        return permissions;
    }

    public String userId() {
        return actor.userId();
    }

    public ScopePredicate scope() {
        return actor.scope();
    }

    public String correlationId() {
        return correlationId;
    }

    // ---- permission checks ----

    public boolean hasPermission(PracticeModule module, AccessLevel required) {
        return permissions.hasPermission(module, required);
    }

    public boolean hasSpecialPermission(SpecialPermission flag) {
        return permissions.hasSpecialPermission(flag);
    }

    /**
     * The level the actor holds on one resource: the module baseline, raised by an explicit
     * grant on that exact resource. The baseline module comes from
     * {@link PracticeModule#forResourceType(String)}; unmapped types have a none baseline. A
     * grant below the baseline is ignored. Deny-all and departed actors never get a raise
     * from grants.
     */
    public AccessLevel resourceAccessLevel(String resourceType, String resourceId) {
        if (resourceType == null || resourceType.isBlank() || resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceType and resourceId must not be null or blank");
        }
        AccessLevel baseline = PracticeModule.forResourceType(resourceType)
                .map(permissions::level)
                .orElse(AccessLevel.NONE);
        if (actor.denyAll() || actor.kind() == ActorKind.DEPARTED_MEMBER) {
            return baseline;
        }
        return grantStore.levelFor(new ResourceKey(resourceType, resourceId, actor.granteeId()))
                .map(granted -> AccessLevel.max(baseline, granted))
                .orElse(baseline);
    }

    /**
     * True if the module baseline suffices, otherwise whether an explicit grant on exactly
     * this resource reaches {@code required}.
     */
    public boolean checkResourceAccess(String resourceType, String resourceId, AccessLevel required) {
        return resourceAccessLevel(resourceType, resourceId).satisfies(required);
    }

    public void requirePermission(PracticeModule module, AccessLevel required) {
        if (!hasPermission(module, required)) {
            throw PermissionDeniedException.module(module, required);
        }
    }

    public void requireSpecialPermission(SpecialPermission flag) {
        if (!hasSpecialPermission(flag)) {
            throw PermissionDeniedException.special(flag);
        }
    }

    public void requireResourceAccess(String resourceType, String resourceId, AccessLevel required) {
        if (!checkResourceAccess(resourceType, resourceId, required)) {
            throw PermissionDeniedException.resource(resourceType, resourceId, required);
        }
    }

    // ---- scoping ----

    public Map<String, Object> scopedQuery(String collection, Map<String, ?> filter) {
        return enforcer.scopedQuery(actor, collection, filter);
    }

    public Map<String, Object> scopedDocument(String collection, Map<String, ?> document) {
        return enforcer.scopedDocument(actor, collection, document);
    }

    public void verifyOwnership(String collection, Map<String, ?> document) {
        enforcer.verifyOwnership(actor, collection, document);
    }

    @Override
    public String toString() {
        return "LexguardSecurityContext[user=" + actor.userId() + ", scope=" + actor.scope().render()
                + ", status=" + actor.status().value() + "]";
    }
}
