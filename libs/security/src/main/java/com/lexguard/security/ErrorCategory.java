package com.lexguard.security;

/**
 * Classes of failure raised by the isolation core. Entry points map each category to a
 * transport status (HTTP, gRPC).
 */
public enum ErrorCategory {

    /** Caller cannot be turned into an actor (401-equivalent). */
    AUTHENTICATION,

    /** Resolved permissions are insufficient (403-equivalent). */
    AUTHORIZATION,

    /** A code path issued a tenant-scoped operation without a scope (500-equivalent). */
    PROGRAMMING_ERROR,

    /** A scope was present but names another tenant (500-equivalent, alerting). */
    SECURITY_INCIDENT,

    /** A concurrent or state-machine conflict (409-equivalent). */
    CONFLICT
}
