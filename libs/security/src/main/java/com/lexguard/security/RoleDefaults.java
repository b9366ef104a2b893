package com.lexguard.security;

import static com.lexguard.security.AccessLevel.EDIT;
import static com.lexguard.security.AccessLevel.FULL;
import static com.lexguard.security.AccessLevel.NONE;
import static com.lexguard.security.AccessLevel.VIEW;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

/**
 * The compiled role to default-permission table.
 * <p>
 * The table is process-wide, immutable, and versioned with the source: changing a default
 * means changing this file and bumping {@link #VERSION}. It is never loaded from runtime
 * data. Unknown role strings resolve to {@link RoleTemplate#DENY_ALL}.
 */
public final class RoleDefaults {

    /** Version of the default table. Bump on every change to a template. */
    public static final String VERSION = "2024.3";

    private static final RoleDefaults STANDARD = new RoleDefaults();

    private final Map<FirmRole, RoleTemplate> templates;

    private RoleDefaults() {
        EnumMap<FirmRole, RoleTemplate> table = new EnumMap<>(FirmRole.class);
        for (FirmRole role : FirmRole.values()) {
            table.put(role, templateOf(role));
        }
        this.templates = Collections.unmodifiableMap(table);
    }

    /** The standard table. */
    public static RoleDefaults standard() {
        return STANDARD;
    }

    public String version() {
        return VERSION;
    }

    public RoleTemplate templateFor(FirmRole role) {
        return role == null ? RoleTemplate.DENY_ALL : templates.get(role);
    }

    /**
     * Template for a stored role string; unknown or null roles get no access.
     */
    public RoleTemplate templateFor(String storedRole) {
        return templateFor(FirmRole.fromString(storedRole));
    }

    public RoleTemplate templateFor(Optional<FirmRole> role) {
        return role.map(templates::get).orElse(RoleTemplate.DENY_ALL);
    }

    public Map<FirmRole, RoleTemplate> templates() {
        return templates;
    }

    private static RoleTemplate templateOf(FirmRole role) {
        return switch (role) {
            case OWNER, ADMIN -> RoleTemplate.uniform(FULL, EnumSet.allOf(SpecialPermission.class));
            case PARTNER -> new RoleTemplate(
                    levels(FULL, FULL, VIEW, VIEW, EDIT, FULL, FULL, FULL, EDIT, VIEW, VIEW),
                    EnumSet.of(SpecialPermission.CAN_APPROVE_INVOICES, SpecialPermission.CAN_MANAGE_RETAINERS,
                            SpecialPermission.CAN_EXPORT_DATA, SpecialPermission.CAN_VIEW_FINANCE,
                            SpecialPermission.CAN_ACCESS_REPORTS));
            case LAWYER -> new RoleTemplate(
                    levels(EDIT, VIEW, NONE, NONE, VIEW, EDIT, EDIT, EDIT, EDIT, NONE, VIEW),
                    EnumSet.of(SpecialPermission.CAN_ACCESS_REPORTS));
            case PARALEGAL -> new RoleTemplate(
                    levels(VIEW, VIEW, NONE, NONE, NONE, VIEW, EDIT, VIEW, EDIT, NONE, NONE),
                    EnumSet.noneOf(SpecialPermission.class));
            case SECRETARY -> new RoleTemplate(
                    levels(VIEW, VIEW, NONE, NONE, NONE, VIEW, VIEW, EDIT, NONE, NONE, NONE),
                    EnumSet.noneOf(SpecialPermission.class));
            case ACCOUNTANT -> new RoleTemplate(
                    levels(NONE, VIEW, FULL, NONE, FULL, NONE, NONE, NONE, VIEW, NONE, NONE),
                    EnumSet.of(SpecialPermission.CAN_APPROVE_INVOICES, SpecialPermission.CAN_MANAGE_RETAINERS,
                            SpecialPermission.CAN_EXPORT_DATA, SpecialPermission.CAN_VIEW_FINANCE,
                            SpecialPermission.CAN_MANAGE_BILLING, SpecialPermission.CAN_ACCESS_REPORTS));
            case DEPARTED -> new RoleTemplate(
                    levels(VIEW, NONE, NONE, NONE, NONE, VIEW, VIEW, NONE, NONE, NONE, NONE),
                    EnumSet.noneOf(SpecialPermission.class));
            case SOLO -> {
                EnumSet<SpecialPermission> flags = EnumSet.allOf(SpecialPermission.class);
                flags.remove(SpecialPermission.CAN_INVITE_MEMBERS);
                yield RoleTemplate.uniform(FULL, flags);
            }
        };
    }

    /**
     * Levels in {@link PracticeModule} declaration order: cases, clients, finance, hr, reports,
     * documents, tasks, calendar, time_tracking, settings, team.
     */
    private static Map<PracticeModule, AccessLevel> levels(AccessLevel... levels) {
        PracticeModule[] modules = PracticeModule.values();
        if (levels.length != modules.length) {
            throw new IllegalStateException("expected " + modules.length + " levels, got " + levels.length);
        }
        EnumMap<PracticeModule, AccessLevel> map = new EnumMap<>(PracticeModule.class);
        for (int i = 0; i < modules.length; i++) {
            map.put(modules[i], levels[i]);
        }
        return map;
    }
}
