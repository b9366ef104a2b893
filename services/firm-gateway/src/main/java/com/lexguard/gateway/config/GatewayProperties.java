package com.lexguard.gateway.config;

import com.lexguard.security.TenantScopedCollections;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration, bound from {@code lexguard.gateway.*}.
 *
 * <pre>
 * lexguard:
 *   gateway:
 *     name: firm-gateway
 *     environment: production
 *     tenant-scoped-collections: [cases, clients, invoices]
 *     grpc-port: 9090
 * </pre>
 *
 * <p>Role defaults are not configurable; they are versioned with {@code RoleDefaults}.
 *
 * @param name service name used for logging and metrics tags. Required.
 * @param environment deployment environment (development, staging, production)
 * @param tenantScopedCollections collections whose documents carry a tenant key
 * @param grpcPort port for the gRPC server (default 9090)
 */
@ConfigurationProperties(prefix = "lexguard.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name, String environment, List<String> tenantScopedCollections, int grpcPort) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (tenantScopedCollections == null || tenantScopedCollections.isEmpty()) {
            tenantScopedCollections = TenantScopedCollections.DEFAULTS;
        } else {
            tenantScopedCollections = List.copyOf(tenantScopedCollections);
        }
        if (grpcPort <= 0) {
            grpcPort = 9090;
        }
    }
}
