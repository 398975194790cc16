package com.celflicks.backend.modules.onboarding.application;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.global.persistence.UniqueViolations;
import com.celflicks.backend.modules.audit.application.AuditLogService;
import com.celflicks.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.celflicks.backend.modules.notification.application.NotificationService;
import com.celflicks.backend.modules.onboarding.config.OnboardingConfig;
import com.celflicks.backend.modules.onboarding.config.OnboardingProperties;
import com.celflicks.backend.modules.onboarding.domain.ProvisionedUser;
import com.celflicks.backend.modules.onboarding.domain.ProvisioningFailedException;
import com.celflicks.backend.modules.profile.application.AvatarUrlResolver;
import com.celflicks.backend.modules.profile.domain.Profile;
import com.celflicks.backend.modules.profile.domain.UsernameConflictException;
import com.celflicks.backend.modules.profile.domain.UsernamePolicy;
import com.celflicks.backend.modules.profile.infrastructure.persistence.ProfileRepository;
import com.celflicks.backend.modules.wallet.application.WalletService;
import com.celflicks.backend.modules.wallet.domain.UserBalance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * 신규 계정 프로비저닝: 프로필, 잔액, 환영 보너스 거래, 환영 알림을 하나의 단위로 생성한다.
 *
 * <p>Each attempt runs in its own transaction. Only a unique violation on the username constraints,
 * i.e. a race lost between the existence check and the insert, is retried; the wait before retry
 * {@code n} is {@code backoffBase * 2^(n-1)}. Every terminal failure except input validation triggers
 * a best-effort cleanup whose own failure is only logged, unless a concurrent call has already
 * provisioned the same user.
 */
@Service
public class UserProvisioningService {

    public static final String METADATA_USERNAME = "username";
    public static final String METADATA_AVATAR_URL = "avatar_url";
    public static final String ALREADY_PROVISIONED = "USER_ALREADY_PROVISIONED";
    static final String ACTION_PROVISIONED = "USER_PROVISIONED";

    private static final Logger log = LoggerFactory.getLogger(UserProvisioningService.class);

    private final AppUserRepository appUserRepository;
    private final ProfileRepository profileRepository;
    private final WalletService walletService;
    private final NotificationService notificationService;
    private final AuditLogService auditLogService;
    private final AvatarUrlResolver avatarUrlResolver;
    private final ProvisioningCleanupService cleanupService;
    private final OnboardingProperties properties;
    private final BackoffSleeper backoffSleeper;
    private final TransactionOperations transactions;

    public UserProvisioningService(
            AppUserRepository appUserRepository,
            ProfileRepository profileRepository,
            WalletService walletService,
            NotificationService notificationService,
            AuditLogService auditLogService,
            AvatarUrlResolver avatarUrlResolver,
            ProvisioningCleanupService cleanupService,
            OnboardingProperties properties,
            BackoffSleeper backoffSleeper,
            @Qualifier(OnboardingConfig.PROVISIONING_TRANSACTIONS) TransactionOperations transactions
    ) {
        this.appUserRepository = appUserRepository;
        this.profileRepository = profileRepository;
        this.walletService = walletService;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
        this.avatarUrlResolver = avatarUrlResolver;
        this.cleanupService = cleanupService;
        this.properties = properties;
        this.backoffSleeper = backoffSleeper;
        this.transactions = transactions;
    }

    /**
     * Provisions an identity that is already committed.
     */
    public ProvisionedUser provision(UUID userId, Map<String, ?> metadata) {
        return provision(userId, metadata, IdentityWriter.NONE);
    }

    public ProvisionedUser provision(UUID userId, Map<String, ?> metadata, IdentityWriter identityWriter) {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(identityWriter, "identityWriter is required");
        Map<String, ?> safeMetadata = metadata != null ? metadata : Map.of();

        String username = UsernamePolicy.requireValid(stringValue(safeMetadata, METADATA_USERNAME));
        String avatarUrl = avatarUrlResolver.resolve(stringValue(safeMetadata, METADATA_AVATAR_URL), username);

        if (profileRepository.existsById(userId)) {
            throw alreadyProvisioned();
        }

        int maxAttempts = properties.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ProvisionedUser provisioned = transactions.execute(
                        status -> provisionOnce(userId, username, avatarUrl, identityWriter)
                );
                log.info("Provisioned user {} as '{}' on attempt {}", userId, username, attempt);
                return provisioned;
            } catch (DataIntegrityViolationException ex) {
                if (!UniqueViolations.isUsernameViolation(ex)) {
                    throw abandon(userId, ex);
                }
                log.warn("Username '{}' was taken concurrently while provisioning user {} (attempt {}/{})",
                        username, userId, attempt, maxAttempts);
                if (attempt < maxAttempts) {
                    waitBeforeRetry(userId, attempt);
                }
            } catch (RuntimeException ex) {
                throw abandon(userId, ex);
            }
        }

        throw abandon(userId, new ProvisioningFailedException(maxAttempts, properties.retryAfterSeconds()));
    }

    private ProvisionedUser provisionOnce(UUID userId, String username, String avatarUrl, IdentityWriter identityWriter) {
        identityWriter.write(userId);
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));

        if (!profileRepository.findByUsernameIgnoreCaseSkipLocked(username).isEmpty()) {
            throw new UsernameConflictException(username);
        }

        Profile profile = profileRepository.saveAndFlush(new Profile(user, username, avatarUrl));

        UserBalance balance = walletService.openWithWelcomeBonus(
                user,
                properties.welcomeBonusAmount(),
                properties.welcomeTransactionDescription()
        );

        Map<String, Object> notificationMetadata = new LinkedHashMap<>();
        notificationMetadata.put("amount", properties.welcomeBonusAmount());
        notificationService.createWelcomeNotification(
                user,
                properties.welcomeNotificationTitle(),
                properties.welcomeNotificationBody(),
                notificationMetadata
        );

        auditLogService.record(new AuditLogCommand(
                ACTION_PROVISIONED,
                "USER",
                userId.toString(),
                userId,
                null,
                Map.of("username", username)
        ));

        // 남은 INSERT의 제약 위반도 이 시도 안에서 드러나도록 한다.
        appUserRepository.flush();
        return new ProvisionedUser(userId, profile.getUsername(), profile.getAvatarUrl(), balance.getBalance());
    }

    private void waitBeforeRetry(UUID userId, int failedAttempt) {
        Duration delay = properties.backoffBase().multipliedBy(1L << (failedAttempt - 1));
        try {
            backoffSleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw abandon(userId, new IllegalStateException("Provisioning of user " + userId + " was interrupted", ex));
        }
    }

    /**
     * Ends a failed provisioning. Our own attempts always roll back, so a profile committed for this
     * user belongs to a concurrent call that won; its rows are kept and the caller sees a conflict.
     */
    private RuntimeException abandon(UUID userId, RuntimeException cause) {
        if (provisionedElsewhere(userId)) {
            log.warn("User {} was provisioned by a concurrent call; skipping cleanup after {}", userId, describe(cause));
            return alreadyProvisioned();
        }
        cleanupQuietly(userId, cause);
        return cause;
    }

    private boolean provisionedElsewhere(UUID userId) {
        try {
            return profileRepository.existsById(userId);
        } catch (RuntimeException lookupFailure) {
            log.warn("Could not check whether user {} is already provisioned", userId, lookupFailure);
            return false;
        }
    }

    private static ProblemException alreadyProvisioned() {
        return new ProblemException(HttpStatus.CONFLICT, ALREADY_PROVISIONED);
    }

    private void cleanupQuietly(UUID userId, Throwable cause) {
        try {
            cleanupService.purge(userId, describe(cause));
        } catch (RuntimeException cleanupFailure) {
            log.warn("Cleanup after failed provisioning of user {} did not complete", userId, cleanupFailure);
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof ProblemException problem) {
            return problem.getCode();
        }
        return cause.getClass().getSimpleName();
    }

    private static String stringValue(Map<String, ?> metadata, String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
