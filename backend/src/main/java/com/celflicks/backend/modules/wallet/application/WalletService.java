package com.celflicks.backend.modules.wallet.application;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.wallet.domain.UserBalance;
import com.celflicks.backend.modules.wallet.domain.WalletTransaction;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.UserBalanceRepository;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.WalletTransactionRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class WalletService {

    private final UserBalanceRepository userBalanceRepository;
    private final WalletTransactionRepository walletTransactionRepository;

    public WalletService(
            UserBalanceRepository userBalanceRepository,
            WalletTransactionRepository walletTransactionRepository
    ) {
        this.userBalanceRepository = userBalanceRepository;
        this.walletTransactionRepository = walletTransactionRepository;
    }

    /**
     * Opens the user's balance at {@code amount} and records the matching welcome bonus ledger entry.
     * Must run inside the provisioning transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserBalance openWithWelcomeBonus(AppUser user, BigDecimal amount, String description) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("welcome bonus amount must be >= 0");
        }
        UserBalance balance = userBalanceRepository.save(new UserBalance(user, amount));
        walletTransactionRepository.save(new WalletTransaction(
                user,
                amount,
                WalletTransaction.TYPE_WELCOME_BONUS,
                description
        ));
        return balance;
    }

    @Transactional(readOnly = true)
    public WalletView getWallet(UUID userId) {
        UserBalance balance = userBalanceRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "WALLET_NOT_FOUND"));
        List<WalletTransaction> transactions = walletTransactionRepository.findByUserIdNewestFirst(userId);
        return new WalletView(userId, balance.getBalance(), transactions);
    }

    public record WalletView(UUID userId, BigDecimal balance, List<WalletTransaction> transactions) {
    }
}
