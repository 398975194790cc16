package com.celflicks.backend.modules.profile.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
        String username,
        @Size(max = 2048, message = "avatarUrl must be at most 2048 characters") String avatarUrl
) {
}
