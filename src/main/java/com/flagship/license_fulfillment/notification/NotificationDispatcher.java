package com.flagship.license_fulfillment.notification;

import com.flagship.license_fulfillment.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queues user and admin notifications through the outbox.
 *
 * Joins the caller's transaction when there is one, so a notification is
 * only ever sent for a state change that actually committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    public static final String ADMIN_RECIPIENT = "admin";
    static final String AGGREGATE_TYPE = "Notification";

    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public NotificationMessage notify(String userId, NotificationType type, String title, String body,
                                      Map<String, String> fields) {
        if (userId == null || userId.isBlank()) {
            log.warn("Dropping {} notification without a recipient: {}", type, title);
            return null;
        }
        NotificationMessage message = new NotificationMessage(type, userId, title, body,
                fields == null ? Map.of() : new LinkedHashMap<>(fields), clock.instant());
        outboxService.saveEvent(AGGREGATE_TYPE, userId, type.name(), message);
        log.info("Queued {} notification for user {}", type, userId);
        return message;
    }

    @Transactional
    public NotificationMessage alertAdmin(String title, String body, Map<String, String> fields) {
        NotificationMessage message = new NotificationMessage(NotificationType.ADMIN_ALERT, ADMIN_RECIPIENT,
                title, body, fields == null ? Map.of() : new LinkedHashMap<>(fields), clock.instant());
        outboxService.saveEvent(AGGREGATE_TYPE, ADMIN_RECIPIENT, NotificationType.ADMIN_ALERT.name(), message);
        log.info("Queued admin alert: {}", title);
        return message;
    }
}
