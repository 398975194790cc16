package com.celflicks.backend.modules.wallet.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record WalletResponse(
        UUID userId,
        BigDecimal balance,
        List<WalletTransactionResponse> transactions
) {
}
