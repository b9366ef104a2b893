package com.lexguard.security;

import java.time.Instant;

/**
 * A stored per-resource grant.
 *
 * @param key       composite key
 * @param level     granted level
 * @param version   version, starting at 1 and incremented on every write
 * @param grantedBy user ID (or system caller) that last wrote the grant
 * @param grantedAt time of the last write
 */
public record ResourceGrant(ResourceKey key, AccessLevel level, long version, String grantedBy, Instant grantedAt) {
}
