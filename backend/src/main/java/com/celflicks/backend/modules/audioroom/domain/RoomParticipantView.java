package com.celflicks.backend.modules.audioroom.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Participant joined with its profile. Participants without a profile are not listed.
 */
public record RoomParticipantView(UUID userId, String username, String avatarUrl, OffsetDateTime joinedAt) {
}
