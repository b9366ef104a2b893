package com.lexguard.security;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a firm member as stored by the member directory.
 * <p>
 * {@code role} is kept as the stored string so that a record carrying a role this build does
 * not know can still be loaded; {@link #firmRole()} parses it, and an unknown role resolves to
 * no access at all. Override maps are sparse: a module or flag absent from the map inherits the
 * role default.
 *
 * @param id                  member identifier (also the grantee ID in resource grants)
 * @param firmId              owning firm
 * @param userId              platform user behind this membership
 * @param role                stored role string, see {@link FirmRole#value()}
 * @param status              membership status
 * @param permissionOverrides per-module overrides of the role default
 * @param specialOverrides    per-flag overrides of the role default
 * @param resourcePermissions per-resource grants recorded on the member
 * @param joinedAt            when the member joined (nullable for legacy records)
 * @param departedAt          when the member departed (null unless departed)
 */
public record Member(
        String id,
        String firmId,
        String userId,
        String role,
        MemberStatus status,
        Map<PracticeModule, AccessLevel> permissionOverrides,
        Map<SpecialPermission, Boolean> specialOverrides,
        List<ResourcePermission> resourcePermissions,
        Instant joinedAt,
        Instant departedAt
) {

    public Member {
        requireText(id, "id");
        requireText(firmId, "firmId");
        requireText(userId, "userId");
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        permissionOverrides = immutableEnumMap(PracticeModule.class, permissionOverrides);
        specialOverrides = immutableEnumMap(SpecialPermission.class, specialOverrides);
        resourcePermissions = resourcePermissions == null ? List.of() : List.copyOf(resourcePermissions);
    }

    /**
     * Convenience constructor for a member without overrides or grants.
     */
    public Member(String id, String firmId, String userId, FirmRole role, MemberStatus status) {
        this(id, firmId, userId, role.value(), status, Map.of(), Map.of(), List.of(), null, null);
    }

    public Optional<FirmRole> firmRole() {
        return FirmRole.fromString(role);
    }

    /** The override for the module, or empty to inherit the role default. */
    public Optional<AccessLevel> overrideFor(PracticeModule module) {
        return Optional.ofNullable(permissionOverrides.get(module));
    }

    /** The override for the flag, or empty to inherit the role default. */
    public Optional<Boolean> specialOverrideFor(SpecialPermission flag) {
        return Optional.ofNullable(specialOverrides.get(flag));
    }

    public Member withStatus(MemberStatus newStatus) {
        return new Member(id, firmId, userId, role, newStatus, permissionOverrides, specialOverrides,
                resourcePermissions, joinedAt, departedAt);
    }

    public Member withRole(FirmRole newRole) {
        return new Member(id, firmId, userId, newRole.value(), status, permissionOverrides, specialOverrides,
                resourcePermissions, joinedAt, departedAt);
    }

    public Member withDepartedAt(Instant newDepartedAt) {
        return new Member(id, firmId, userId, role, status, permissionOverrides, specialOverrides,
                resourcePermissions, joinedAt, newDepartedAt);
    }

    public Member withPermissionOverrides(Map<PracticeModule, AccessLevel> overrides) {
        return new Member(id, firmId, userId, role, status, overrides, specialOverrides,
                resourcePermissions, joinedAt, departedAt);
    }

    public Member withSpecialOverrides(Map<SpecialPermission, Boolean> overrides) {
        return new Member(id, firmId, userId, role, status, permissionOverrides, overrides,
                resourcePermissions, joinedAt, departedAt);
    }

    public Member withResourcePermissions(List<ResourcePermission> permissions) {
        return new Member(id, firmId, userId, role, status, permissionOverrides, specialOverrides,
                permissions, joinedAt, departedAt);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private static <K extends Enum<K>, V> Map<K, V> immutableEnumMap(Class<K> type, Map<K, V> source) {
        EnumMap<K, V> copy = new EnumMap<>(type);
        if (source != null) {
            source.forEach((key, value) -> {
                if (value == null) {
                    throw new IllegalArgumentException("override for " + key + " must not be null");
                }
                copy.put(key, value);
            });
        }
        return Collections.unmodifiableMap(copy);
    }
}
