package com.lexguard.security;

import java.util.EnumMap;
import java.util.EnumSet;

/**
 * Computes the {@link EffectivePermissionSet} of an actor.
 * <p>
 * Order of application:
 * <ol>
 *   <li>role default ({@link RoleTemplate#DENY_ALL} for an unknown role)</li>
 *   <li>per-module overrides, which may raise or lower the default</li>
 *   <li>suspended or pending approval: everything none, no flags; stop</li>
 *   <li>special flags: role default merged with per-flag overrides</li>
 *   <li>departed: every module clamped to view, no flags</li>
 * </ol>
 * The result depends only on the arguments, so resolving the same snapshot twice yields equal
 * sets.
 */
public final class PermissionResolver {

    private PermissionResolver() {
        // utility class
    }

    /**
     * @param actor    the resolved actor
     * @param defaults the role default table
     * @param member   the member snapshot; ignored (may be null) for solo practitioners
     */
    public static EffectivePermissionSet resolve(ActorContext actor, RoleDefaults defaults, Member member) {
        if (actor == null || defaults == null) {
            throw new IllegalArgumentException("actor and defaults must not be null");
        }
        if (actor.isSolo()) {
            RoleTemplate solo = defaults.templateFor(FirmRole.SOLO);
            return new EffectivePermissionSet(solo.modules(), solo.specialPermissions());
        }
        if (member == null) {
            throw new IllegalArgumentException("member must not be null for firm actors");
        }

        RoleTemplate template = defaults.templateFor(member.role());
        EnumMap<PracticeModule, AccessLevel> levels = new EnumMap<>(PracticeModule.class);
        for (PracticeModule module : PracticeModule.values()) {
            levels.put(module, member.overrideFor(module).orElse(template.level(module)));
        }

        MemberStatus status = member.status();
        if (actor.denyAll() || status == MemberStatus.SUSPENDED || status == MemberStatus.PENDING_APPROVAL) {
            return EffectivePermissionSet.denyAll();
        }

        EnumSet<SpecialPermission> flags = EnumSet.noneOf(SpecialPermission.class);
        for (SpecialPermission flag : SpecialPermission.values()) {
            if (member.specialOverrideFor(flag).orElse(template.grants(flag))) {
                flags.add(flag);
            }
        }

        if (status == MemberStatus.DEPARTED || actor.kind() == ActorKind.DEPARTED_MEMBER) {
            levels.replaceAll((module, level) -> AccessLevel.min(level, AccessLevel.VIEW));
            flags.clear();
        }
        return new EffectivePermissionSet(levels, flags);
    }

    /** Convenience for {@code resolve(actor, defaults, actor.member())}. */
    public static EffectivePermissionSet resolve(ActorContext actor, RoleDefaults defaults) {
        return resolve(actor, defaults, actor.member());
    }
}
