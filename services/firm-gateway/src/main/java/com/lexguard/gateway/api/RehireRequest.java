package com.lexguard.gateway.api;

import jakarta.validation.constraints.NotBlank;

public record RehireRequest(@NotBlank String role) {}
