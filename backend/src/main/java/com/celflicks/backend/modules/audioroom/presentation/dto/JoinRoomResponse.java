package com.celflicks.backend.modules.audioroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JoinRoomResponse(UUID roomId, UUID userId, OffsetDateTime joinedAt) {
}
