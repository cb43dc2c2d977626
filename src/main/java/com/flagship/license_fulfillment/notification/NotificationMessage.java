package com.flagship.license_fulfillment.notification;

import java.time.Instant;
import java.util.Map;

/**
 * What the chat layer should deliver, and to whom.
 *
 * @param recipient user id, or {@link NotificationDispatcher#ADMIN_RECIPIENT}
 * @param fields    structured details (license key, product, txid, ...) for rich rendering
 */
public record NotificationMessage(
    NotificationType type,
    String recipient,
    String title,
    String body,
    Map<String, String> fields,
    Instant createdAt
) {
}
