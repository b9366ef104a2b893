package com.lexguard.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexguard.observability.AuditRedactor;
import com.lexguard.observability.SecurityMetrics;
import com.lexguard.observability.SecuritySpans;
import com.lexguard.security.InMemoryMemberDirectory;
import com.lexguard.security.InMemoryResourceGrantStore;
import com.lexguard.security.MemberLifecycle;
import com.lexguard.security.QueryIsolationEnforcer;
import com.lexguard.security.ResourceGrantService;
import com.lexguard.security.RoleDefaults;
import com.lexguard.security.SecurityAuditLog;
import com.lexguard.security.SecurityContextFactory;
import com.lexguard.security.Slf4jSecurityAuditLog;
import com.lexguard.security.TenantContextResolver;
import com.lexguard.security.TenantScopedCollections;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the isolation core. Everything here is a singleton; the per-request
 * {@link com.lexguard.security.LexguardSecurityContext} is built by {@link SecurityContextFactory}.
 */
@Configuration
public class SecurityCoreConfig {

    static final String INSTRUMENTATION_SCOPE = "com.lexguard.gateway";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoleDefaults roleDefaults() {
        return RoleDefaults.standard();
    }

    @Bean
    public InMemoryMemberDirectory memberDirectory() {
        return new InMemoryMemberDirectory();
    }

    @Bean
    public InMemoryResourceGrantStore resourceGrantStore(Clock clock) {
        return new InMemoryResourceGrantStore(clock);
    }

    @Bean
    public AuditRedactor auditRedactor() {
        return new AuditRedactor();
    }

    @Bean
    public SecurityAuditLog securityAuditLog(ObjectMapper objectMapper, AuditRedactor redactor) {
        return new Slf4jSecurityAuditLog(objectMapper, redactor);
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry registry, GatewayProperties properties) {
        return new SecurityMetrics(registry, properties.name());
    }

    @Bean
    public SecuritySpans securitySpans(ObjectProvider<OpenTelemetry> openTelemetry) {
        OpenTelemetry otel = openTelemetry.getIfAvailable(GlobalOpenTelemetry::get);
        return new SecuritySpans(otel.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public TenantScopedCollections tenantScopedCollections(GatewayProperties properties) {
        return TenantScopedCollections.of(properties.tenantScopedCollections());
    }

    @Bean
    public QueryIsolationEnforcer queryIsolationEnforcer(
            TenantScopedCollections collections, SecurityMetrics metrics, SecurityAuditLog auditLog, Clock clock) {
        return new QueryIsolationEnforcer(collections, metrics, auditLog, clock);
    }

    @Bean
    public TenantContextResolver tenantContextResolver(InMemoryMemberDirectory directory, SecurityAuditLog auditLog) {
        return new TenantContextResolver(directory, auditLog);
    }

    @Bean
    public SecurityContextFactory securityContextFactory(
            TenantContextResolver resolver,
            RoleDefaults roleDefaults,
            QueryIsolationEnforcer enforcer,
            InMemoryResourceGrantStore grantStore,
            SecurityMetrics metrics,
            SecuritySpans spans) {
        return new SecurityContextFactory(resolver, roleDefaults, enforcer, grantStore, metrics, spans);
    }

    @Bean
    public ResourceGrantService resourceGrantService(
            InMemoryResourceGrantStore grantStore,
            InMemoryMemberDirectory directory,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog) {
        return new ResourceGrantService(grantStore, directory, metrics, auditLog);
    }

    @Bean
    public MemberLifecycle memberLifecycle(
            InMemoryMemberDirectory directory,
            InMemoryResourceGrantStore grantStore,
            SecurityMetrics metrics,
            SecurityAuditLog auditLog,
            Clock clock) {
        return new MemberLifecycle(directory, grantStore, metrics, auditLog, clock);
    }
}
