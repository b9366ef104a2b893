package com.lexguard.gateway;

import com.lexguard.gateway.config.GatewayProperties;
import com.lexguard.security.RoleDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * LexGuard firm gateway.
 *
 * <p>Resolves the actor of every request, computes its permissions once, and exposes the resource
 * grant administration, member lifecycle and my-permissions endpoints on top of the isolation
 * core.
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class FirmGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(FirmGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FirmGatewayApplication.class, args);
        log.info("LexGuard firm gateway started with role defaults {}", RoleDefaults.standard().version());
    }
}
