package com.lexguard.gateway.api;

import com.lexguard.security.AccessLevel;
import com.lexguard.security.ActorContext;
import com.lexguard.security.EffectivePermissionSet;
import com.lexguard.security.FirmRole;
import com.lexguard.security.PracticeModule;
import com.lexguard.security.SpecialPermission;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The caller's resolved view of themselves: scope, role, status, module levels and every special
 * flag (false when not held).
 */
public record MyPermissionsResponse(
        String userId,
        String scope,
        String role,
        String status,
        boolean restricted,
        Map<String, String> modules,
        Map<String, Boolean> specialPermissions) {

    static MyPermissionsResponse of(ActorContext actor, EffectivePermissionSet permissions) {
        Map<String, String> modules = new LinkedHashMap<>();
        for (PracticeModule module : PracticeModule.values()) {
            AccessLevel level = permissions.level(module);
            modules.put(module.value(), level.value());
        }
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (SpecialPermission flag : SpecialPermission.values()) {
            flags.put(flag.value(), permissions.hasSpecialPermission(flag));
        }
        return new MyPermissionsResponse(
                actor.userId(),
                actor.scope().render(),
                actor.role().map(FirmRole::value).orElse(null),
                actor.status().value(),
                actor.selfScope().isPresent(),
                modules,
                flags);
    }
}
