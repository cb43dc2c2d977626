package com.flagship.license_fulfillment.notification;

public enum NotificationType {
    LICENSE_ISSUED,
    PAYMENT_FAILED,
    LICENSE_REFUNDED,
    CRYPTO_PAYMENT_EXPIRED,
    ADMIN_ALERT
}
