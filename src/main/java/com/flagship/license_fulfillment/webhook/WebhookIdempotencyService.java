package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which provider payments have already been fulfilled.
 *
 * Redis is a fast path only; the license table (one license per source
 * payment id) is the source of truth and is consulted whenever Redis misses
 * or is unavailable.
 */
@Service
@Slf4j
public class WebhookIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "webhook:fulfilled:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LicenseRegistry licenseRegistry;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final FulfillmentMetrics metrics;

    public WebhookIdempotencyService(LicenseRegistry licenseRegistry,
                                     Optional<StringRedisTemplate> redisTemplate,
                                     FulfillmentMetrics metrics) {
        this.licenseRegistry = licenseRegistry;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    public boolean isAlreadyFulfilled(String providerPaymentId) {
        if (providerPaymentId == null || providerPaymentId.isBlank()) {
            throw new IllegalArgumentException("Provider payment id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + providerPaymentId))) {
                    log.debug("Payment {} found in Redis fulfillment cache", providerPaymentId);
                    metrics.recordIdempotencyHit();
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for payment {}. Falling back to database. Error: {}",
                        providerPaymentId, e.getMessage());
            }
        }

        if (licenseRegistry.isIssuedFor(providerPaymentId)) {
            metrics.recordIdempotencyHit();
            remember(providerPaymentId);
            return true;
        }
        metrics.recordIdempotencyMiss();
        return false;
    }

    /**
     * Caches a fulfilled payment id. Best effort: a Redis failure is logged and ignored.
     */
    public void markFulfilled(String providerPaymentId) {
        remember(providerPaymentId);
    }

    private void remember(String providerPaymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + providerPaymentId, "1", REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache fulfilled payment {} in Redis: {}", providerPaymentId, e.getMessage());
        }
    }
}
