package com.celflicks.backend.modules.wallet.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record WalletTransactionResponse(
        UUID id,
        BigDecimal amount,
        String type,
        String description,
        OffsetDateTime createdAt
) {
}
