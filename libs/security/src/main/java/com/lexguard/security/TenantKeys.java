package com.lexguard.security;

/**
 * Field names the isolation core reads and writes on tenant-scoped documents and filters.
 */
public final class TenantKeys {

    /** Tenant key of firm-owned documents. */
    public static final String FIRM_ID = "firmId";

    /** Tenant key of documents owned by a solo practitioner. */
    public static final String LAWYER_ID = "lawyerId";

    /** Creator/owner of a document, used by the departed self-scope restriction. */
    public static final String OWNER_ID = "ownerId";

    /** Assignee of a document, used by the departed self-scope restriction. */
    public static final String ASSIGNEE_ID = "assigneeId";

    public static final String OR = "$or";
    public static final String AND = "$and";
    public static final String EQ = "$eq";

    private TenantKeys() {
        // constants
    }
}
