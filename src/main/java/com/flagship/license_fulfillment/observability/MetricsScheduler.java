package com.flagship.license_fulfillment.observability;

import com.flagship.license_fulfillment.crypto.CryptoPaymentMonitor;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need database queries, so a Prometheus scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final FulfillmentMetrics fulfillmentMetrics;
    private final PaymentLedger ledger;
    private final LicenseRegistry licenseRegistry;
    private final CryptoPaymentMonitor monitor;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            fulfillmentMetrics.updateBacklog(ledger.stats().pendingCryptoPayments(),
                    monitor.activeCount(), licenseRegistry.countActive());
        } catch (Exception e) {
            log.warn("Failed to refresh fulfillment gauges: {}", e.getMessage());
        }
    }
}
