package com.celflicks.backend.modules.audioroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.celflicks.backend.modules.audioroom.domain.RoomParticipantView;

public record RoomParticipantResponse(UUID userId, String username, String avatarUrl, OffsetDateTime joinedAt) {

    public static RoomParticipantResponse from(RoomParticipantView view) {
        return new RoomParticipantResponse(view.userId(), view.username(), view.avatarUrl(), view.joinedAt());
    }
}
