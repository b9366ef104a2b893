package com.lexguard.security;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link MemberDirectory} held in memory. Used by the gateway's local profile and by tests.
 */
public class InMemoryMemberDirectory implements MemberDirectory {

    private final Map<String, Firm> firms = new ConcurrentHashMap<>();
    private final Map<String, Member> members = new ConcurrentHashMap<>();

    public Firm saveFirm(Firm firm) {
        firms.put(firm.id(), firm);
        return firm;
    }

    @Override
    public Optional<Firm> findFirm(String firmId) {
        return firmId == null ? Optional.empty() : Optional.ofNullable(firms.get(firmId));
    }

    @Override
    public Optional<Member> findMember(String firmId, String userId) {
        return members.values().stream()
                .filter(member -> member.firmId().equals(firmId) && member.userId().equals(userId))
                .findFirst();
    }

    @Override
    public Optional<Member> findMemberById(String memberId) {
        return memberId == null ? Optional.empty() : Optional.ofNullable(members.get(memberId));
    }

    @Override
    public List<Member> findMembersOfFirm(String firmId) {
        return members.values().stream()
                .filter(member -> member.firmId().equals(firmId))
                .sorted(Comparator.comparing(Member::id))
                .toList();
    }

    @Override
    public Member save(Member member) {
        if (!firms.containsKey(member.firmId())) {
            throw new IllegalArgumentException("Unknown firm: " + member.firmId());
        }
        members.put(member.id(), member);
        return member;
    }

    @Override
    public Member update(String memberId, UnaryOperator<Member> change) {
        if (memberId == null) {
            throw new IllegalArgumentException("memberId must not be null");
        }
        Member updated = members.computeIfPresent(memberId, (id, current) -> {
            Member next = change.apply(current);
            if (!next.id().equals(id) || !next.firmId().equals(current.firmId())) {
                throw new IllegalArgumentException("An update cannot move member " + id);
            }
            return next;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown member: " + memberId);
        }
        return updated;
    }
}
