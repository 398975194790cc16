package com.celflicks.backend.modules.audioroom.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AudioRoomRequest(
        @NotBlank(message = "title is required") @Size(max = 200, message = "title must be at most 200 characters") String title
) {
}
