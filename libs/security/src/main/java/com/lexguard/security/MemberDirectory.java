package com.lexguard.security;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read/write access to firms and their members. The directory is authoritative for a
 * member's role and status; claims carried by an {@link ActorIdentity} are not.
 */
public interface MemberDirectory {

    Optional<Firm> findFirm(String firmId);

    /** The membership of {@code userId} in {@code firmId}. */
    Optional<Member> findMember(String firmId, String userId);

    Optional<Member> findMemberById(String memberId);

    List<Member> findMembersOfFirm(String firmId);

    /** Stores the member, replacing any previous snapshot with the same ID. */
    Member save(Member member);

    /**
     * Atomically replaces the stored member with {@code change} applied to its current record.
     * Concurrent updates of one member are serialized; {@code change} sees the latest record
     * and may throw to abort the update, leaving the stored member untouched.
     *
     * @throws IllegalArgumentException if no member has the given ID
     */
    Member update(String memberId, UnaryOperator<Member> change);
}
