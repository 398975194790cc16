package com.celflicks.backend.modules.onboarding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.modules.audit.domain.AuditLog;
import com.celflicks.backend.modules.audit.infrastructure.AuditLogRepository;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.notification.domain.Notification;
import com.celflicks.backend.modules.notification.domain.NotificationState;
import com.celflicks.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.celflicks.backend.modules.onboarding.application.UserProvisioningService;
import com.celflicks.backend.modules.onboarding.domain.ProvisionedUser;
import com.celflicks.backend.modules.onboarding.domain.ProvisioningFailedException;
import com.celflicks.backend.modules.profile.domain.Profile;
import com.celflicks.backend.modules.profile.domain.UsernameConflictException;
import com.celflicks.backend.modules.profile.domain.UsernameValidationException;
import com.celflicks.backend.modules.profile.infrastructure.persistence.ProfileRepository;
import com.celflicks.backend.modules.wallet.domain.UserBalance;
import com.celflicks.backend.modules.wallet.domain.WalletTransaction;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.UserBalanceRepository;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.WalletTransactionRepository;
import com.celflicks.backend.support.AbstractPostgresIntegrationTest;
import com.celflicks.backend.support.TestUserFactory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class UserProvisioningIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private UserProvisioningService provisioningService;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private UserBalanceRepository userBalanceRepository;

    @Autowired
    private WalletTransactionRepository walletTransactionRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Test
    @DisplayName("신규 사용자에게 프로필, 잔액, 환영 거래, 환영 알림이 모두 생성된다")
    void provisionsProfileWalletAndWelcomeNotification() {
        AppUser user = testUserFactory.createIdentity("alice@example.com");

        ProvisionedUser result = provisioningService.provision(user.getId(), Map.of("username", "alice_01"));

        assertThat(result.username()).isEqualTo("alice_01");

        Profile profile = profileRepository.findById(user.getId()).orElseThrow();
        assertThat(profile.getUsername()).isEqualTo("alice_01");
        assertThat(profile.getAvatarUrl()).isEqualTo("https://ui-avatars.com/api/?name=alice_01&background=random");
        assertThat(profile.getCreatedAt()).isNotNull();

        UserBalance balance = userBalanceRepository.findById(user.getId()).orElseThrow();
        assertThat(balance.getBalance()).isEqualByComparingTo("5.00");

        List<WalletTransaction> transactions = walletTransactionRepository.findByUserIdNewestFirst(user.getId());
        assertThat(transactions).singleElement().satisfies(transaction -> {
            assertThat(transaction.getAmount()).isEqualByComparingTo(new BigDecimal("5.00"));
            assertThat(transaction.getType()).isEqualTo(WalletTransaction.TYPE_WELCOME_BONUS);
            assertThat(transaction.getDescription()).isEqualTo("Welcome bonus for new user");
        });

        List<Notification> notifications = notificationRepository.findByUserIdAndState(user.getId(), NotificationState.UNREAD);
        assertThat(notifications).singleElement().satisfies(notification -> {
            assertThat(notification.getKindCode()).isEqualTo("welcome_bonus");
            assertThat(notification.getTitle()).isEqualTo("Welcome to Celflicks!");
            assertThat(notification.getBody()).isEqualTo("Thanks for joining! You've received 5 XCE as a welcome bonus.");
        });

        List<AuditLog> audit = auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("USER", user.getId().toString());
        assertThat(audit).extracting(AuditLog::getActionType).containsExactly("USER_PROVISIONED");
    }

    @Test
    void keepsProvidedAvatarUrlVerbatim() {
        AppUser user = testUserFactory.createIdentity("bob@example.com");

        provisioningService.provision(user.getId(), Map.of(
                "username", "Bob-7",
                "avatar_url", "https://cdn.example.com/avatars/bob.png?v=3"
        ));

        assertThat(profileRepository.findById(user.getId()).orElseThrow().getAvatarUrl())
                .isEqualTo("https://cdn.example.com/avatars/bob.png?v=3");
    }

    @Test
    @DisplayName("대소문자만 다른 username은 충돌로 거부되고 아무 행도 남지 않는다")
    void caseInsensitiveDuplicateIsRejectedWithoutLeftovers() {
        AppUser first = testUserFactory.createIdentity("first@example.com");
        AppUser second = testUserFactory.createIdentity("second@example.com");
        provisioningService.provision(first.getId(), Map.of("username", "alice_01"));

        assertThatThrownBy(() -> provisioningService.provision(second.getId(), Map.of("username", "ALICE_01")))
                .isInstanceOf(UsernameConflictException.class)
                .hasMessageContaining(UsernameConflictException.USERNAME_ALREADY_EXISTS);

        assertNoProvisionedRows(second.getId());
        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("USER", second.getId().toString()))
                .isEmpty();
    }

    @Test
    @DisplayName("이미 쓰인 username으로 반복 호출해도 같은 오류로 끝나고 행이 늘지 않는다")
    void repeatedConflictFailsIdenticallyWithoutSideEffects() {
        AppUser first = testUserFactory.createIdentity("first@example.com");
        AppUser second = testUserFactory.createIdentity("second@example.com");
        provisioningService.provision(first.getId(), Map.of("username", "alice_01"));

        Throwable firstFailure = catchThrowable(
                () -> provisioningService.provision(second.getId(), Map.of("username", "ALICE_01")));
        List<Long> countsAfterFirstFailure = rowCounts();

        Throwable secondFailure = catchThrowable(
                () -> provisioningService.provision(second.getId(), Map.of("username", "ALICE_01")));

        assertThat(firstFailure).isInstanceOf(UsernameConflictException.class);
        assertThat(secondFailure).isInstanceOf(UsernameConflictException.class);
        assertThat(((UsernameConflictException) secondFailure).getCode())
                .isEqualTo(((UsernameConflictException) firstFailure).getCode())
                .isEqualTo(UsernameConflictException.USERNAME_ALREADY_EXISTS);
        assertThat(rowCounts()).isEqualTo(countsAfterFirstFailure);
    }

    @Test
    void invalidUsernameLeavesNoRows() {
        AppUser user = testUserFactory.createIdentity("carol@example.com");

        assertThatThrownBy(() -> provisioningService.provision(user.getId(), Map.of("username", "no")))
                .isInstanceOf(UsernameValidationException.class);

        assertNoProvisionedRows(user.getId());
    }

    @Test
    void unknownUserIsRejected() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> provisioningService.provision(unknown, Map.of("username", "ghost_user")))
                .hasMessageContaining("USER_NOT_FOUND");

        assertNoProvisionedRows(unknown);
    }

    @Test
    @DisplayName("같은 username으로 동시에 가입하면 정확히 한 명만 성공한다")
    void concurrentProvisioningWithSameUsernameHasSingleWinner() throws Exception {
        AppUser first = testUserFactory.createIdentity("racer1@example.com");
        AppUser second = testUserFactory.createIdentity("racer2@example.com");
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            List<Future<ProvisionedUser>> futures = new ArrayList<>();
            for (AppUser racer : List.of(first, second)) {
                Callable<ProvisionedUser> task = () -> {
                    start.await();
                    return provisioningService.provision(racer.getId(), Map.of("username", "racer"));
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int successes = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<ProvisionedUser> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException ex) {
                    failures.add(ex.getCause());
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(failures).singleElement()
                    .isInstanceOfAny(UsernameConflictException.class, ProvisioningFailedException.class);
        } finally {
            executor.shutdownNow();
        }

        assertThat(profileRepository.findByUsernameIgnoreCase("racer")).isPresent();
        long profiles = profileRepository.count();
        long balances = userBalanceRepository.count();
        assertThat(profiles).isEqualTo(1);
        assertThat(balances).isEqualTo(1);
        assertThat(walletTransactionRepository.count()).isEqualTo(1);
        assertThat(notificationRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 사용자를 동시에 프로비저닝하면 승자의 데이터는 지워지지 않는다")
    void concurrentProvisioningOfSameUserKeepsWinnerRows() throws Exception {
        AppUser user = testUserFactory.createIdentity("twice@example.com");
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        int successes = 0;
        List<Throwable> failures = new ArrayList<>();
        try {
            List<Future<ProvisionedUser>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                Callable<ProvisionedUser> task = () -> {
                    start.await();
                    return provisioningService.provision(user.getId(), Map.of("username", "twice"));
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            for (Future<ProvisionedUser> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException ex) {
                    failures.add(ex.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(successes).isEqualTo(1);
        assertThat(failures).singleElement()
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(UserProvisioningService.ALREADY_PROVISIONED));
        assertThat(profileRepository.findById(user.getId())).isPresent();
        assertThat(userBalanceRepository.findById(user.getId())).isPresent();
        assertThat(walletTransactionRepository.countByUserId(user.getId())).isEqualTo(1);
        assertThat(notificationRepository.countByUserId(user.getId())).isEqualTo(1);
    }

    private List<Long> rowCounts() {
        return List.of(
                profileRepository.count(),
                userBalanceRepository.count(),
                walletTransactionRepository.count(),
                notificationRepository.count(),
                auditLogRepository.count()
        );
    }

    private void assertNoProvisionedRows(UUID userId) {
        assertThat(profileRepository.findById(userId)).isEmpty();
        assertThat(userBalanceRepository.findById(userId)).isEmpty();
        assertThat(walletTransactionRepository.countByUserId(userId)).isZero();
        assertThat(notificationRepository.countByUserId(userId)).isZero();
    }
}
