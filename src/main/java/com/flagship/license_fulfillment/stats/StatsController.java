package com.flagship.license_fulfillment.stats;

import com.flagship.license_fulfillment.crypto.CryptoPaymentMonitor;
import com.flagship.license_fulfillment.guard.AbuseStateSnapshot;
import com.flagship.license_fulfillment.guard.AntiAbuseGuard;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.payment.LedgerStats;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator overview of licenses, payments and abuse tracking.
 */
@RestController
@RequiredArgsConstructor
public class StatsController {

    private final LicenseRegistry licenseRegistry;
    private final PaymentLedger ledger;
    private final AntiAbuseGuard guard;
    private final CryptoPaymentMonitor monitor;

    @GetMapping("/api/stats")
    public SystemStats stats() {
        LedgerStats payments = ledger.stats();
        AbuseStateSnapshot abuse = guard.snapshot();
        return SystemStats.builder()
                .totalLicenses(licenseRegistry.countAll())
                .activeLicenses(licenseRegistry.countActive())
                .totalPayments(payments.pendingIntents() + payments.completedIntents()
                    + payments.failedIntents() + payments.refundedIntents())
                .completedPayments(payments.completedIntents())
                .pendingPayments(payments.pendingIntents())
                .failedPayments(payments.failedIntents())
                .refundedPayments(payments.refundedIntents())
                .pendingCryptoPayments(payments.pendingCryptoPayments())
                .completedCryptoPayments(payments.completedCryptoPayments())
                .expiredCryptoPayments(payments.expiredCryptoPayments())
                .monitoredCryptoPayments(monitor.activeCount())
                .currentRateLimits(abuse.rateLimitWindows())
                .userCooldowns(abuse.cooldowns())
                .suspiciousActivities(abuse.suspiciousUsers())
                .build();
    }
}
