package com.flagship.license_fulfillment.payment;

/**
 * Point-in-time counts of recorded payments by status.
 */
public record LedgerStats(
    long pendingIntents,
    long completedIntents,
    long failedIntents,
    long refundedIntents,
    long pendingCryptoPayments,
    long completedCryptoPayments,
    long expiredCryptoPayments
) {
}
