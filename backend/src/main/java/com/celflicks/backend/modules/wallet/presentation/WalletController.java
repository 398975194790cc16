package com.celflicks.backend.modules.wallet.presentation;

import java.util.List;
import java.util.UUID;

import com.celflicks.backend.global.security.SecurityUtils;
import com.celflicks.backend.modules.wallet.application.WalletService;
import com.celflicks.backend.modules.wallet.application.WalletService.WalletView;
import com.celflicks.backend.modules.wallet.presentation.dto.WalletResponse;
import com.celflicks.backend.modules.wallet.presentation.dto.WalletTransactionResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WalletController {

    private final WalletService walletService;

    public WalletController(WalletService walletService) {
        this.walletService = walletService;
    }

    @Operation(summary = "내 지갑 조회", description = "잔액과 최신순 거래 내역을 반환합니다.")
    @GetMapping("/wallet/me")
    public ResponseEntity<WalletResponse> myWallet() {
        UUID userId = SecurityUtils.getCurrentUserId();
        WalletView wallet = walletService.getWallet(userId);
        List<WalletTransactionResponse> transactions = wallet.transactions().stream()
                .map(tx -> new WalletTransactionResponse(
                        tx.getId(),
                        tx.getAmount(),
                        tx.getType(),
                        tx.getDescription(),
                        tx.getCreatedAt()
                ))
                .toList();
        return ResponseEntity.ok(new WalletResponse(wallet.userId(), wallet.balance(), transactions));
    }
}
