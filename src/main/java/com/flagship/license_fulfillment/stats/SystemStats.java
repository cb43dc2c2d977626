package com.flagship.license_fulfillment.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SystemStats {

    @JsonProperty("total_licenses")
    long totalLicenses;

    @JsonProperty("active_licenses")
    long activeLicenses;

    @JsonProperty("total_payments")
    long totalPayments;

    @JsonProperty("completed_payments")
    long completedPayments;

    @JsonProperty("pending_payments")
    long pendingPayments;

    @JsonProperty("failed_payments")
    long failedPayments;

    @JsonProperty("refunded_payments")
    long refundedPayments;

    @JsonProperty("pending_crypto_payments")
    long pendingCryptoPayments;

    @JsonProperty("completed_crypto_payments")
    long completedCryptoPayments;

    @JsonProperty("expired_crypto_payments")
    long expiredCryptoPayments;

    @JsonProperty("monitored_crypto_payments")
    int monitoredCryptoPayments;

    @JsonProperty("current_rate_limits")
    int currentRateLimits;

    @JsonProperty("user_cooldowns")
    int userCooldowns;

    @JsonProperty("suspicious_activities")
    int suspiciousActivities;
}
