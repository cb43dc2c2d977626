package com.flagship.license_fulfillment.payment;

/**
 * Lifecycle of an on-chain payment: PENDING → COMPLETED | EXPIRED, both terminal.
 */
public enum CryptoPaymentStatus {
    PENDING,
    COMPLETED,
    EXPIRED
}
