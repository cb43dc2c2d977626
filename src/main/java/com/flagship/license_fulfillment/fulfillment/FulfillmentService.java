package com.flagship.license_fulfillment.fulfillment;

import com.flagship.license_fulfillment.crypto.TransactionMatch;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.license.LicenseSource;
import com.flagship.license_fulfillment.notification.NotificationDispatcher;
import com.flagship.license_fulfillment.notification.NotificationType;
import com.flagship.license_fulfillment.observability.CorrelationContext;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.payment.PurchaseIntent;
import com.flagship.license_fulfillment.payment.PurchaseIntentStatus;
import com.flagship.license_fulfillment.payment.PurchaseIntentUpdate;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The shared "issue license, complete payment, tell the user" step behind
 * both the webhook and the crypto monitor, plus the failure, refund and
 * expiry transitions that notify users.
 *
 * Each operation is one transaction: the license row, the payment status
 * change and the outbox notification commit or roll back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FulfillmentService {

    private final PaymentLedger ledger;
    private final LicenseRegistry licenseRegistry;
    private final NotificationDispatcher notifications;
    private final FulfillmentMetrics metrics;

    /**
     * Fulfills a provider-confirmed payment.
     *
     * @param intentId the intent the payment was correlated to, or null when
     *                 only the buyer is known
     */
    @Transactional
    public FulfillmentOutcome fulfillFiat(String userId, UUID intentId, ProductType productType,
                                          String providerPaymentId) {
        CorrelationContext.tagPayment(providerPaymentId, userId);

        if (licenseRegistry.isIssuedFor(providerPaymentId)) {
            log.info("Payment {} already has a license; ignoring replay", providerPaymentId);
            metrics.recordIdempotencyHit();
            return FulfillmentOutcome.duplicate();
        }

        if (intentId != null) {
            Optional<PurchaseIntent> intent = ledger.lockIntent(intentId);
            if (intent.isPresent() && !intent.get().isPending()) {
                log.info("Purchase intent {} is already {}; ignoring payment {}",
                        intentId, intent.get().getStatus(), providerPaymentId);
                metrics.recordIdempotencyHit();
                return FulfillmentOutcome.duplicate();
            }
            if (intent.isEmpty()) {
                log.warn("Purchase intent {} referenced by payment {} does not exist", intentId, providerPaymentId);
                intentId = null;
            } else if (intent.get().getProductType() != productType) {
                log.warn("Payment {} is for {} but intent {} was for {}; issuing what was paid for",
                        providerPaymentId, productType.getCode(), intentId, intent.get().getProductType().getCode());
            }
        } else {
            log.warn("Fulfilling payment {} for user {} without a recorded purchase intent", providerPaymentId, userId);
        }

        UUID resolvedIntentId = intentId;
        License license = metrics.timeFulfillment(() -> {
            License issued = licenseRegistry.issue(userId, productType, providerPaymentId, LicenseSource.FIAT);
            if (resolvedIntentId != null) {
                ledger.transition(resolvedIntentId, PurchaseIntentStatus.COMPLETED,
                        PurchaseIntentUpdate.completed(providerPaymentId, issued.getLicenseKey()));
            }
            return issued;
        });

        metrics.recordLicenseIssued(LicenseSource.FIAT.name());
        notifyLicenseIssued(license, Map.of("paymentId", providerPaymentId));
        notifications.alertAdmin("New purchase",
                String.format("User %s bought %s", userId, productType.getDisplayName()),
                licenseFields(license, Map.of("paymentId", providerPaymentId, "source", "fiat")));
        return FulfillmentOutcome.fulfilled(license);
    }

    /**
     * Completes a crypto payment with the matched transaction and issues its license.
     * Returns empty when the payment had already left PENDING.
     */
    @Transactional
    public Optional<License> fulfillCrypto(UUID paymentId, TransactionMatch match) {
        Optional<CryptoPayment> completed = ledger.completeCrypto(paymentId, match.txid());
        if (completed.isEmpty()) {
            log.info("Crypto payment {} is no longer pending; transaction {} not applied", paymentId, match.txid());
            return Optional.empty();
        }

        CryptoPayment payment = completed.get();
        CorrelationContext.tagPayment(paymentId, payment.getUserId());
        License license = metrics.timeFulfillment(() -> licenseRegistry.issue(payment.getUserId(),
                payment.getProductType(), paymentId.toString(), LicenseSource.CRYPTO));

        metrics.recordLicenseIssued(LicenseSource.CRYPTO.name());
        metrics.recordCryptoMatch(payment.getAsset().name());

        Map<String, String> cryptoFields = new LinkedHashMap<>();
        cryptoFields.put("amount", payment.getCryptoAmount().toPlainString() + " " + payment.getAsset());
        cryptoFields.put("txid", match.txid());
        cryptoFields.put("transactionLink", payment.getAsset().explorerLink(match.txid()));
        notifyLicenseIssued(license, cryptoFields);
        notifications.alertAdmin("New crypto purchase",
                String.format("User %s paid %s %s for %s", payment.getUserId(),
                    payment.getCryptoAmount().toPlainString(), payment.getAsset(), payment.getProductType().getDisplayName()),
                licenseFields(license, cryptoFields));

        log.info("Crypto payment {} confirmed by transaction {}", paymentId, match.txid());
        return Optional.of(license);
    }

    /**
     * Expires a pending crypto payment and tells the user.
     *
     * @return whether this call performed the transition
     */
    @Transactional
    public boolean expireCrypto(UUID paymentId, String reason) {
        Optional<CryptoPayment> expired = ledger.expireCrypto(paymentId);
        if (expired.isEmpty()) {
            return false;
        }
        CryptoPayment payment = expired.get();
        metrics.recordCryptoExpired(reason);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("product", payment.getProductType().getDisplayName());
        fields.put("amount", payment.getCryptoAmount().toPlainString() + " " + payment.getAsset());
        fields.put("paymentId", paymentId.toString());
        notifications.notify(payment.getUserId(), NotificationType.CRYPTO_PAYMENT_EXPIRED, "Payment expired",
                "Your cryptocurrency payment window has expired. Start a new purchase to try again.", fields);
        log.info("Crypto payment {} expired ({})", paymentId, reason);
        return true;
    }

    /**
     * Marks a pending intent failed and tells the buyer. A failure that
     * arrives after the intent already settled is logged and dropped, so a
     * buyer who has paid is never told the payment failed.
     */
    @Transactional
    public Optional<PurchaseIntent> failIntent(UUID intentId, String userId, String reason) {
        String failureReason = reason == null || reason.isBlank() ? "Unknown error" : reason;
        Optional<PurchaseIntent> failed = intentId == null
                ? Optional.empty()
                : ledger.transition(intentId, PurchaseIntentStatus.FAILED, PurchaseIntentUpdate.failed(failureReason));

        if (failed.isEmpty() && intentId != null) {
            Optional<PurchaseIntent> settled = ledger.findIntent(intentId);
            if (settled.isPresent()) {
                log.info("Ignoring late failure for purchase intent {}; it is already {}",
                        intentId, settled.get().getStatus());
                return Optional.empty();
            }
        }

        String recipient = failed.map(PurchaseIntent::getUserId).orElse(userId);
        notifications.notify(recipient, NotificationType.PAYMENT_FAILED, "Payment failed",
                "Your payment could not be processed. Please try again or contact support.",
                Map.of("reason", failureReason));
        return failed;
    }

    /**
     * Revokes the license bought with a refunded payment and records the refund.
     */
    @Transactional
    public Optional<License> refund(String providerPaymentId) {
        Optional<License> revoked = licenseRegistry.deactivateForRefund(providerPaymentId);
        ledger.findIntentByProviderPaymentId(providerPaymentId)
                .ifPresent(intent -> ledger.transition(intent.getId(), PurchaseIntentStatus.REFUNDED, PurchaseIntentUpdate.none()));

        revoked.ifPresent(license -> {
            metrics.recordLicensesDeactivated("refunded", 1);
            notifications.notify(license.getUserId(), NotificationType.LICENSE_REFUNDED, "License revoked",
                    "Your payment was refunded and the license bought with it has been deactivated.",
                    licenseFields(license, Map.of("paymentId", providerPaymentId)));
            notifications.alertAdmin("Refund processed",
                    String.format("License %s revoked after refund of payment %s", license.getLicenseKey(), providerPaymentId),
                    Map.of("paymentId", providerPaymentId));
        });
        return revoked;
    }

    private void notifyLicenseIssued(License license, Map<String, String> extra) {
        notifications.notify(license.getUserId(), NotificationType.LICENSE_ISSUED, "Payment confirmed",
                "Thank you for your purchase! Your license key is ready.", licenseFields(license, extra));
    }

    private static Map<String, String> licenseFields(License license, Map<String, String> extra) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("licenseKey", license.getLicenseKey());
        fields.put("product", license.getProductType().getDisplayName());
        fields.put("expirationDate", license.getExpirationDate().toString());
        fields.putAll(extra);
        return fields;
    }
}
