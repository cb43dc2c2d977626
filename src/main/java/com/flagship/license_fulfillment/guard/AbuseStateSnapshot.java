package com.flagship.license_fulfillment.guard;

/**
 * Sizes of the in-memory abuse tracking maps.
 */
public record AbuseStateSnapshot(int rateLimitWindows, int cooldowns, int suspiciousUsers) {
}
