package com.lexguard.gateway.infrastructure.web;

import com.lexguard.security.ActorIdentity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Headers set by the authentication proxy in front of the gateway once the session or token has
 * been validated.
 */
public final class ActorHeaders {

    public static final String USER_ID = "X-Actor-User-Id";
    public static final String FIRM_ID = "X-Actor-Firm-Id";
    public static final String FIRM_ROLE = "X-Actor-Firm-Role";
    public static final String MEMBER_STATUS = "X-Actor-Member-Status";

    private ActorHeaders() {
        // utility class
    }

    /**
     * Reads the identity claims. Absent headers become null; blank values are passed through so
     * the resolver can reject them.
     */
    public static ActorIdentity identityOf(HttpServletRequest request) {
        return new ActorIdentity(
                request.getHeader(USER_ID),
                request.getHeader(FIRM_ID),
                request.getHeader(FIRM_ROLE),
                request.getHeader(MEMBER_STATUS));
    }
}
