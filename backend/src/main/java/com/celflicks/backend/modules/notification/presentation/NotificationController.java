package com.celflicks.backend.modules.notification.presentation;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.global.security.SecurityUtils;
import com.celflicks.backend.modules.notification.application.NotificationService;
import com.celflicks.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.celflicks.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.celflicks.backend.modules.notification.domain.Notification;
import com.celflicks.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.celflicks.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.celflicks.backend.modules.notification.presentation.dto.NotificationListResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "state", defaultValue = "all") String stateParam,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        NotificationFilterState filter = parseState(stateParam);
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        UUID userId = SecurityUtils.getCurrentUserId();
        NotificationPageResult result = notificationService.getNotifications(
                userId,
                filter,
                PageRequest.of(safePage, safeSize)
        );

        List<NotificationItemResponse> items = result.notifications().stream()
                .map(this::toItemResponse)
                .toList();

        return ResponseEntity.ok(new NotificationListResponse(
                items,
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        ));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") UUID notificationId) {
        notificationService.markNotificationRead(SecurityUtils.getCurrentUserId(), notificationId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/read-all")
    public ResponseEntity<MarkAllReadResponse> markAllRead() {
        int updated = notificationService.markAllNotificationsRead(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(new MarkAllReadResponse(updated));
    }

    private NotificationFilterState parseState(String raw) {
        try {
            return NotificationFilterState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_STATE_FILTER", "state must be one of all, unread, read");
        }
    }

    private NotificationItemResponse toItemResponse(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getReadAt(),
                notification.getMetadata()
        );
    }
}
