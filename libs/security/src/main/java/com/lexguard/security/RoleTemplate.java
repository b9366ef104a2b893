package com.lexguard.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Default permissions of one role: a level for every module plus the special flags the role
 * holds. Modules missing from the supplied map are stored as {@link AccessLevel#NONE}.
 *
 * @param modules            level per module (total after construction)
 * @param specialPermissions flags granted by default
 */
public record RoleTemplate(Map<PracticeModule, AccessLevel> modules, Set<SpecialPermission> specialPermissions) {

    /** No module access, no flags. Used for unknown roles. */
    public static final RoleTemplate DENY_ALL = new RoleTemplate(Map.of(), Set.of());

    public RoleTemplate {
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

    /**
     * Template granting {@code level} on every module.
     */
    public static RoleTemplate uniform(AccessLevel level, Set<SpecialPermission> flags) {
        EnumMap<PracticeModule, AccessLevel> all = new EnumMap<>(PracticeModule.class);
        for (PracticeModule module : PracticeModule.values()) {
            all.put(module, level);
        }
        return new RoleTemplate(all, flags);
    }

    public AccessLevel level(PracticeModule module) {
        return modules.get(module);
    }

    public boolean grants(SpecialPermission flag) {
        return specialPermissions.contains(flag);
    }
}
