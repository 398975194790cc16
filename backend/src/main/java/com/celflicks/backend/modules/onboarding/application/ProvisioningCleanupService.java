package com.celflicks.backend.modules.onboarding.application;

import java.util.Map;
import java.util.UUID;

import com.celflicks.backend.modules.audit.application.AuditLogService;
import com.celflicks.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.celflicks.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.celflicks.backend.modules.profile.infrastructure.persistence.ProfileRepository;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.UserBalanceRepository;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.WalletTransactionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes whatever a failed provisioning left behind for a user. Runs in its own transaction.
 */
@Service
public class ProvisioningCleanupService {

    static final String ACTION_ROLLED_BACK = "USER_PROVISIONING_ROLLED_BACK";

    private static final Logger log = LoggerFactory.getLogger(ProvisioningCleanupService.class);

    private final ProfileRepository profileRepository;
    private final UserBalanceRepository userBalanceRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final NotificationRepository notificationRepository;
    private final AuditLogService auditLogService;

    public ProvisioningCleanupService(
            ProfileRepository profileRepository,
            UserBalanceRepository userBalanceRepository,
            WalletTransactionRepository walletTransactionRepository,
            NotificationRepository notificationRepository,
            AuditLogService auditLogService
    ) {
        this.profileRepository = profileRepository;
        this.userBalanceRepository = userBalanceRepository;
        this.walletTransactionRepository = walletTransactionRepository;
        this.notificationRepository = notificationRepository;
        this.auditLogService = auditLogService;
    }

    /**
     * @return number of rows removed; nothing is audited when there was nothing to remove
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int purge(UUID userId, String reason) {
        int profiles = profileRepository.deleteByUserId(userId);
        int balances = userBalanceRepository.deleteByUserId(userId);
        int transactions = walletTransactionRepository.deleteByUserId(userId);
        int notifications = notificationRepository.deleteByUserId(userId);
        int deletedRows = profiles + balances + transactions + notifications;

        if (deletedRows == 0) {
            log.debug("No partial provisioning state for user {} ({})", userId, reason);
            return 0;
        }

        log.info("Removed partial provisioning state for user {} (profile={}, balance={}, transactions={}, notifications={})",
                userId, profiles, balances, transactions, notifications);
        auditLogService.record(new AuditLogCommand(
                ACTION_ROLLED_BACK,
                "USER",
                userId.toString(),
                null,
                null,
                Map.of(
                        "reason", reason == null ? "unknown" : reason,
                        "deletedRows", deletedRows
                )
        ));
        return deletedRows;
    }
}
