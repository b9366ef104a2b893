package com.lexguard.gateway.api;

import com.lexguard.security.ResourceGrant;

public record GrantResponse(
        String resourceType,
        String resourceId,
        String memberId,
        String level,
        long version,
        String grantedBy,
        String grantedAt) {

    static GrantResponse from(ResourceGrant grant) {
        return new GrantResponse(
                grant.key().resourceType(),
                grant.key().resourceId(),
                grant.key().memberId(),
                grant.level().value(),
                grant.version(),
                grant.grantedBy(),
                grant.grantedAt().toString());
    }
}
