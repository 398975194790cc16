package com.celflicks.backend.modules.notification.presentation.dto;

public record MarkAllReadResponse(int updatedCount) {
}
