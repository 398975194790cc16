package com.celflicks.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.celflicks.backend.modules.profile.domain.Profile;

public record ProfileResponse(
        UUID userId,
        String username,
        String avatarUrl,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ProfileResponse from(Profile profile) {
        return new ProfileResponse(
                profile.getId(),
                profile.getUsername(),
                profile.getAvatarUrl(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }
}
