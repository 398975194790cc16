package com.celflicks.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LoginResponse(UUID userId, AccessTokenResponse token) {
}
