package com.lexguard.security;

/**
 * Thrown when a tenant-scoped read carries no scope predicate and no bypass. This is a
 * programming error: retrying cannot fix a missing predicate.
 */
public class FirmIsolationViolationException extends TenantSecurityException {

    private final String collection;
    private final String expectedScope;

    public FirmIsolationViolationException(String collection, ScopePredicate expected) {
        super(ErrorCategory.PROGRAMMING_ERROR,
                "Query on tenant-scoped collection '%s' has no '%s' predicate (expected %s)"
                        .formatted(collection, expected.tenantKey(), expected.render()));
        this.collection = collection;
        this.expectedScope = expected.render();
    }

    public String collection() {
        return collection;
    }

    public String expectedScope() {
        return expectedScope;
    }
}
