package com.lexguard.security;

import java.util.Optional;

/**
 * Resolved tenant context of one request. Built once by {@link TenantContextResolver},
 * never mutated, never persisted.
 *
 * @param userId      the authenticated user
 * @param kind        actor shape
 * @param scope       the scope predicate every tenant-scoped operation must carry
 * @param role        effective role (solo practitioners carry {@link FirmRole#SOLO}; empty for an unknown stored role)
 * @param status      membership status ({@link MemberStatus#ACTIVE} for solo practitioners)
 * @param denyAll     true when the actor must resolve to no access at all (suspended, pending approval)
 * @param restriction self-scope restriction for departed members, null otherwise
 * @param member      the member snapshot the context was built from, null for solo practitioners
 */
public record ActorContext(
        String userId,
        ActorKind kind,
        ScopePredicate scope,
        Optional<FirmRole> role,
        MemberStatus status,
        boolean denyAll,
        SelfScopeRestriction restriction,
        Member member
) {

    public ActorContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (kind == null || scope == null || status == null) {
            throw new IllegalArgumentException("kind, scope and status must not be null");
        }
        role = role == null ? Optional.empty() : role;
        if (kind == ActorKind.DEPARTED_MEMBER && restriction == null) {
            throw new IllegalArgumentException("departed actors require a self-scope restriction");
        }
        if (kind != ActorKind.SOLO_PRACTITIONER && member == null) {
            throw new IllegalArgumentException("firm actors require a member snapshot");
        }
    }

    /** Context of a solo practitioner: scoped by their own user ID, full role. */
    public static ActorContext solo(String userId) {
        return new ActorContext(userId, ActorKind.SOLO_PRACTITIONER, ScopePredicate.lawyer(userId),
                Optional.of(FirmRole.SOLO), MemberStatus.ACTIVE, false, null, null);
    }

    public Optional<SelfScopeRestriction> selfScope() {
        return Optional.ofNullable(restriction);
    }

    public Optional<Member> memberSnapshot() {
        return Optional.ofNullable(member);
    }

    /** The member ID for firm actors, the user ID for solo practitioners. */
    public String granteeId() {
        return member != null ? member.id() : userId;
    }

    public boolean isSolo() {
        return kind == ActorKind.SOLO_PRACTITIONER;
    }
}
