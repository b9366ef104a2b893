package com.lexguard.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The permissions of one actor for one request: a level for every module plus the special
 * flags held. Immutable; safe to share between sub-operations of the same request.
 *
 * @param modules            level per module (total; missing modules are stored as none)
 * @param specialPermissions flags held
 */
public record EffectivePermissionSet(Map<PracticeModule, AccessLevel> modules, Set<SpecialPermission> specialPermissions) {

    private static final EffectivePermissionSet DENY_ALL = new EffectivePermissionSet(Map.of(), Set.of());

    public EffectivePermissionSet {
        EnumMap<PracticeModule, AccessLevel> total = new EnumMap<>(PracticeModule.class);
        for (PracticeModule module : PracticeModule.values()) {
            AccessLevel level = modules == null ? null : modules.get(module);
            total.put(module, level == null ? AccessLevel.NONE : level);
        }
        modules = Collections.unmodifiableMap(total);

        EnumSet<SpecialPermission> flags = EnumSet.noneOf(SpecialPermission.class);
        if (specialPermissions != null) {
            flags.addAll(specialPermissions);
        }
        specialPermissions = Collections.unmodifiableSet(flags);
    }

    /** Every module none, no flags. */
    public static EffectivePermissionSet denyAll() {
        return DENY_ALL;
    }

    public AccessLevel level(PracticeModule module) {
        return modules.get(module);
    }

    public boolean hasPermission(PracticeModule module, AccessLevel required) {
        return level(module).satisfies(required);
    }

    public boolean hasSpecialPermission(SpecialPermission flag) {
        return specialPermissions.contains(flag);
    }

    public boolean isDenyAll() {
        return specialPermissions.isEmpty()
                && modules.values().stream().allMatch(level -> level == AccessLevel.NONE);
    }
}
