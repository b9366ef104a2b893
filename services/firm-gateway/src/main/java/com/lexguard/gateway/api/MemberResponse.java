package com.lexguard.gateway.api;

import com.lexguard.security.Member;

public record MemberResponse(
        String id, String firmId, String userId, String role, String status, String departedAt) {

    static MemberResponse from(Member member) {
        return new MemberResponse(
                member.id(),
                member.firmId(),
                member.userId(),
                member.role(),
                member.status().value(),
                member.departedAt() != null ? member.departedAt().toString() : null);
    }
}
