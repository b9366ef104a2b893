package com.lexguard.security;

/**
 * Thrown when an operation names a tenant other than the caller's. Always treated as a
 * potential security incident.
 */
public class CrossTenantViolationException extends TenantSecurityException {

    private final String collection;
    private final String expectedScope;
    private final String actualScope;

    public CrossTenantViolationException(String collection, ScopePredicate expected, String actualScope) {
        super(ErrorCategory.SECURITY_INCIDENT,
                "Cross-tenant access on '%s': context scope %s cannot touch %s"
                        .formatted(collection, expected.render(), actualScope));
        this.collection = collection;
        this.expectedScope = expected.render();
        this.actualScope = actualScope;
    }

    public String collection() {
        return collection;
    }

    public String expectedScope() {
        return expectedScope;
    }

    public String actualScope() {
        return actualScope;
    }
}
