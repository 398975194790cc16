package com.celflicks.backend.modules.audioroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.celflicks.backend.modules.audioroom.domain.AudioRoom;

public record AudioRoomResponse(
        UUID id,
        String title,
        UUID hostId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AudioRoomResponse from(AudioRoom room) {
        return new AudioRoomResponse(
                room.getId(),
                room.getTitle(),
                room.getHost().getId(),
                room.getCreatedAt(),
                room.getUpdatedAt()
        );
    }
}
