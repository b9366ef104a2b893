package com.lexguard.gateway.config;

import com.lexguard.gateway.infrastructure.web.SecurityContextArgumentResolver;
import com.lexguard.security.SecurityContextFactory;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration: CORS for local frontends and the security context argument. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SecurityContextFactory securityContextFactory;

    public WebConfig(SecurityContextFactory securityContextFactory) {
        this.securityContextFactory = securityContextFactory;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new SecurityContextArgumentResolver(securityContextFactory));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
