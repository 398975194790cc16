package com.celflicks.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email) {
}
