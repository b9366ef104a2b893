package com.lexguard.security;

import com.lexguard.observability.RequestCorrelationHolder;
import com.lexguard.observability.SecurityMetrics;
import com.lexguard.observability.SecuritySpans;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@link LexguardSecurityContext} of a request: resolves the actor, computes its
 * permissions once, and binds user and scope to the request correlation (and thereby the MDC).
 */
public class SecurityContextFactory {

    static final String SPAN_NAME = "lexguard.security.resolve-actor";

    private final TenantContextResolver resolver;
    private final RoleDefaults roleDefaults;
    private final QueryIsolationEnforcer enforcer;
    private final ResourceGrantStore grantStore;
    private final SecurityMetrics metrics;
    private final SecuritySpans spans;

    public SecurityContextFactory(
            TenantContextResolver resolver,
            RoleDefaults roleDefaults,
            QueryIsolationEnforcer enforcer,
            ResourceGrantStore grantStore,
            SecurityMetrics metrics,
            SecuritySpans spans) {
        if (resolver == null || roleDefaults == null || enforcer == null
                || grantStore == null || metrics == null || spans == null) {
            throw new IllegalArgumentException("all collaborators are required");
        }
        this.resolver = resolver;
        this.roleDefaults = roleDefaults;
        this.enforcer = enforcer;
        this.grantStore = grantStore;
        this.metrics = metrics;
        this.spans = spans;
    }

    /**
     * @throws TenantSecurityException if the identity cannot be resolved
     */
    public LexguardSecurityContext create(ActorIdentity identity) {
        String correlationId = RequestCorrelationHolder.currentCorrelationId();
        Map<String, String> attributes = new LinkedHashMap<>();
        if (correlationId != null) {
            attributes.put(SecuritySpans.ATTR_CORRELATION_ID, correlationId);
        }
        if (identity != null && identity.userId() != null) {
            attributes.put(SecuritySpans.ATTR_USER_ID, identity.userId());
        }
        return spans.inSpan(SPAN_NAME, attributes, () -> {
            ActorContext actor = resolver.resolve(identity);
            EffectivePermissionSet permissions = metrics.timeResolution(
                    () -> PermissionResolver.resolve(actor, roleDefaults));
            RequestCorrelationHolder.bindActor(actor.userId(), actor.scope().render());
            return new LexguardSecurityContext(actor, permissions, enforcer, grantStore, correlationId);
        });
    }
}
