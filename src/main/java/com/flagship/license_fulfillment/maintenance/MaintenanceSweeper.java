package com.flagship.license_fulfillment.maintenance;

import com.flagship.license_fulfillment.fulfillment.FulfillmentService;
import com.flagship.license_fulfillment.guard.AntiAbuseGuard;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.observability.CorrelationContext;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.outbox.OutboxService;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Periodic housekeeping.
 *
 * Daily: deactivate licenses past their expiration date, prune in-memory
 * abuse state and purge old published notifications. Every few minutes:
 * expire crypto payments whose window has passed. Each pass logs its own
 * failure and leaves the retry to the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaintenanceSweeper {

    private final LicenseRegistry licenseRegistry;
    private final PaymentLedger ledger;
    private final FulfillmentService fulfillmentService;
    private final AntiAbuseGuard guard;
    private final OutboxService outboxService;
    private final FulfillmentMetrics metrics;
    private final Clock clock;

    @Value("${maintenance.outbox-retention:P7D}")
    private Duration outboxRetention;

    @Scheduled(cron = "${maintenance.daily-cron:0 0 0 * * *}")
    public void runDailySweep() {
        CorrelationContext.begin("daily");
        try {
            log.info("Running daily cleanup");
            expireLicenses();
            guard.pruneExpiredState();
            int purged = outboxService.purgePublishedBefore(clock.instant().minus(outboxRetention));
            if (purged > 0) {
                log.info("Purged {} published notifications", purged);
            }
            log.info("Daily cleanup completed");
        } catch (Exception e) {
            log.error("Daily cleanup failed; will retry on the next run", e);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Scheduled(fixedDelayString = "${maintenance.crypto-expiry-interval:PT5M}")
    public void runCryptoExpirySweep() {
        CorrelationContext.begin("expiry");
        try {
            expireCryptoPayments();
        } catch (Exception e) {
            log.error("Crypto expiry sweep failed; will retry on the next run", e);
        } finally {
            CorrelationContext.clear();
        }
    }

    /**
     * @return number of licenses deactivated
     */
    public int expireLicenses() {
        List<License> expired = licenseRegistry.expireOverdue();
        metrics.recordLicensesDeactivated("expired", expired.size());
        return expired.size();
    }

    /**
     * Expires each overdue pending payment in its own transaction so one bad
     * row does not hold back the rest.
     *
     * @return number of payments expired by this pass
     */
    public int expireCryptoPayments() {
        List<UUID> overdue = ledger.findExpiredPendingCryptoPayments(clock.instant());
        int expired = 0;
        for (UUID paymentId : overdue) {
            try {
                if (fulfillmentService.expireCrypto(paymentId, "sweeper")) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire crypto payment {}", paymentId, e);
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue crypto payments", expired);
        }
        return expired;
    }
}
