package com.celflicks.backend.modules.onboarding.domain;

import java.math.BigDecimal;
import java.util.UUID;

public record ProvisionedUser(UUID userId, String username, String avatarUrl, BigDecimal balance) {
}
