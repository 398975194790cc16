package com.celflicks.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.notification.domain.Notification;
import com.celflicks.backend.modules.notification.domain.NotificationState;
import com.celflicks.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    public static final String KIND_WELCOME_BONUS = "welcome_bonus";
    static final String DEDUPE_WELCOME_BONUS = "WELCOME_BONUS";

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    /**
     * 가입 환영 알림. 사용자당 한 건만 존재하도록 dedupe key로 기존 알림을 재사용한다.
     */
    public Notification createWelcomeNotification(AppUser user, String title, String body, Map<String, Object> metadata) {
        return notificationRepository.findByUserIdAndDedupeKey(user.getId(), DEDUPE_WELCOME_BONUS)
                .orElseGet(() -> {
                    Notification notification = new Notification();
                    notification.setUser(user);
                    notification.setKindCode(KIND_WELCOME_BONUS);
                    notification.setTitle(title);
                    notification.setBody(body);
                    notification.setDedupeKey(DEDUPE_WELCOME_BONUS);
                    notification.setMetadata(metadata);
                    return notificationRepository.save(notification);
                });
    }

    @Transactional(readOnly = true)
    public NotificationPageResult getNotifications(UUID userId, NotificationFilterState filter, Pageable pageable) {
        List<NotificationState> states = switch (filter) {
            case ALL -> List.of(NotificationState.UNREAD, NotificationState.READ);
            case UNREAD -> List.of(NotificationState.UNREAD);
            case READ -> List.of(NotificationState.READ);
        };

        Page<Notification> page = notificationRepository.findByUserIdAndStates(userId, states, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);

        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public void markNotificationRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));

        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
    }

    public int markAllNotificationsRead(UUID userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndState(userId, NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
