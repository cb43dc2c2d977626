package com.flagship.license_fulfillment.payment;

/**
 * Lifecycle of a fiat purchase intent.
 *
 * PENDING → COMPLETED | FAILED, and COMPLETED → REFUNDED.
 * FAILED and REFUNDED are terminal.
 */
public enum PurchaseIntentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED
}
