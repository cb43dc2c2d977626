package com.flagship.license_fulfillment.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer meters for the fulfillment pipeline.
 *
 * Metrics exposed:
 * - licenses.issued{source}: licenses created per payment source
 * - licenses.deactivated{reason}: expiries and refunds
 * - webhook.events{type,outcome}: webhook deliveries by result
 * - webhook.correlation{confidence}: how the purchaser was identified
 * - crypto.polls{asset,result}, crypto.matches{asset}, crypto.expired{reason}
 * - guard.rejections{reason}
 * - idempotency.cache{result}
 * - fulfillment.duration: time spent in the issue-and-complete step
 * - crypto.payments.pending, crypto.monitors.active, licenses.active: gauges
 *   refreshed by {@link MetricsScheduler}
 */
@Component
public class FulfillmentMetrics {

    private final MeterRegistry registry;
    private final Timer fulfillmentTimer;
    private final Counter unresolvedWebhooks;
    private final AtomicLong pendingCryptoPayments = new AtomicLong(0);
    private final AtomicLong activeMonitors = new AtomicLong(0);
    private final AtomicLong activeLicenses = new AtomicLong(0);

    public FulfillmentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.fulfillmentTimer = Timer.builder("fulfillment.duration")
                .description("Time taken to issue a license and complete its payment")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.unresolvedWebhooks = Counter.builder("webhook.unresolved")
                .description("Successful payments that could not be tied to a purchaser")
                .register(registry);

        registry.gauge("crypto.payments.pending", pendingCryptoPayments);
        registry.gauge("crypto.monitors.active", activeMonitors);
        registry.gauge("licenses.active", activeLicenses);
    }

    public void updateBacklog(long pendingCrypto, int monitors, long licenses) {
        pendingCryptoPayments.set(pendingCrypto);
        activeMonitors.set(monitors);
        activeLicenses.set(licenses);
    }

    public void recordLicenseIssued(String source) {
        registry.counter("licenses.issued", "source", sanitizeTag(source)).increment();
    }

    public void recordLicensesDeactivated(String reason, int count) {
        if (count > 0) {
            registry.counter("licenses.deactivated", "reason", sanitizeTag(reason)).increment(count);
        }
    }

    public void recordWebhook(String eventType, String outcome) {
        registry.counter("webhook.events",
                "type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCorrelation(String confidence) {
        registry.counter("webhook.correlation", "confidence", sanitizeTag(confidence)).increment();
    }

    public void recordUnresolvedWebhook() {
        unresolvedWebhooks.increment();
    }

    public void recordCryptoPoll(String asset, String result) {
        registry.counter("crypto.polls",
                "asset", sanitizeTag(asset),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordCryptoMatch(String asset) {
        registry.counter("crypto.matches", "asset", sanitizeTag(asset)).increment();
    }

    public void recordCryptoExpired(String reason) {
        registry.counter("crypto.expired", "reason", sanitizeTag(reason)).increment();
    }

    public void recordGuardRejection(String reason) {
        registry.counter("guard.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T timeFulfillment(Supplier<T> operation) {
        return fulfillmentTimer.record(operation);
    }

    /**
     * Keeps tag values short and Prometheus-friendly.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
