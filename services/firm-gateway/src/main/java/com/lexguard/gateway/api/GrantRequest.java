package com.lexguard.gateway.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of {@code POST /api/v1/grants}.
 *
 * @param expectedVersion version the caller last saw, {@code 0} for "must not exist yet"; omit to
 *     overwrite unconditionally
 */
public record GrantRequest(
        @NotBlank String resourceType,
        @NotBlank String resourceId,
        @NotBlank String memberId,
        @NotBlank String level,
        @PositiveOrZero Long expectedVersion) {}
