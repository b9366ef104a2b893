package com.lexguard.gateway.api;

import com.lexguard.security.AccessLevel;
import com.lexguard.security.LexguardSecurityContext;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/me")
public class PermissionController {

    @GetMapping("/permissions")
    public MyPermissionsResponse myPermissions(LexguardSecurityContext caller) {
        return MyPermissionsResponse.of(caller.actor(), caller.permissions());
    }

    /** Effective access to one resource: module baseline raised by any explicit grant. */
    @GetMapping("/resources/{resourceType}/{resourceId}")
    public Map<String, String> resourceAccess(
            LexguardSecurityContext caller, @PathVariable String resourceType, @PathVariable String resourceId) {
        AccessLevel level = caller.resourceAccessLevel(resourceType, resourceId);
        return Map.of("resourceType", resourceType, "resourceId", resourceId, "level", level.value());
    }
}
