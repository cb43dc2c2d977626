package com.flagship.license_fulfillment.purchase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.crypto.CryptoPaymentMonitor;
import com.flagship.license_fulfillment.crypto.PriceOracle;
import com.flagship.license_fulfillment.guard.AntiAbuseGuard;
import com.flagship.license_fulfillment.guard.DuplicateCheck;
import com.flagship.license_fulfillment.guard.PurchaseRejectedException;
import com.flagship.license_fulfillment.guard.UserProfile;
import com.flagship.license_fulfillment.guard.UserValidation;
import com.flagship.license_fulfillment.notification.NotificationDispatcher;
import com.flagship.license_fulfillment.observability.CorrelationContext;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.product.ProductCatalog;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.purchase.dto.CheckoutResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for purchases started from the chat layer.
 *
 * Guards run in a fixed order: rate limit, cooldown, duplicate purchase,
 * account validation. The first rejection wins and nothing is recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    static final String FIAT_COMMAND = "buy";
    static final String CRYPTO_COMMAND = "buy-crypto";

    private final AntiAbuseGuard guard;
    private final PaymentLedger ledger;
    private final ProductCatalog productCatalog;
    private final PriceOracle priceOracle;
    private final CryptoPaymentMonitor monitor;
    private final NotificationDispatcher notifications;
    private final FulfillmentMetrics metrics;
    private final FulfillmentProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Records a pending intent and returns the hosted checkout link carrying
     * the correlation token.
     *
     * @throws PurchaseRejectedException if a guard refuses the purchase
     */
    public CheckoutResponse startFiatPurchase(String userId, ProductType productType, UserProfile profile) {
        CorrelationContext.tagPayment(null, userId);
        runGuards(userId, productType, profile, FIAT_COMMAND);

        String providerProductId = productCatalog.providerProductId(productType);
        UUID intentId = ledger.createPendingFiat(userId, productType, providerProductId);
        String checkoutUrl = checkoutUrl(providerProductId, userId, intentId);
        log.info("Generated checkout link for user {} ({}): intent {}", userId, productType.getCode(), intentId);

        return CheckoutResponse.builder()
                .intentId(intentId)
                .productType(productType)
                .productName(productType.getDisplayName())
                .checkoutUrl(checkoutUrl)
                .build();
    }

    /**
     * Quotes the product in the chosen asset, records a pending crypto payment
     * and starts watching the chain for it.
     *
     * @throws PurchaseRejectedException if a guard refuses the purchase
     * @throws com.flagship.license_fulfillment.crypto.ChainDataException if no price is available
     */
    public CryptoPayment startCryptoPurchase(String userId, ProductType productType, CryptoAsset asset,
                                             UserProfile profile) {
        CorrelationContext.tagPayment(null, userId);
        String wallet = properties.getWallets().get(asset);
        if (wallet == null || wallet.isBlank()) {
            throw new IllegalArgumentException("Unsupported crypto asset: " + asset);
        }
        runGuards(userId, productType, profile, CRYPTO_COMMAND);

        BigDecimal usdAmount = productType.getCryptoUsdPrice();
        BigDecimal cryptoAmount = priceOracle.quote(asset, usdAmount);
        CryptoPayment payment = ledger.createPendingCrypto(userId, productType, asset, cryptoAmount, usdAmount, wallet);
        monitor.start(payment.getId());
        return payment;
    }

    public Optional<CryptoPayment> latestCryptoPayment(String userId) {
        return ledger.findLatestCryptoPayment(userId);
    }

    private void runGuards(String userId, ProductType productType, UserProfile profile, String command) {
        if (guard.trackSuspiciousActivity(userId, command + ":" + productType.getCode())) {
            notifications.alertAdmin("Suspicious activity",
                    String.format("User %s is making an unusual number of purchase attempts", userId),
                    Map.of("userId", userId, "command", command));
        }

        if (!guard.checkRateLimit(userId, command)) {
            reject("rate_limited", PurchaseRejectedException.rateLimited(), userId);
        }
        if (!guard.checkPurchaseCooldown(userId)) {
            reject("cooldown", PurchaseRejectedException.coolingDown(), userId);
        }
        DuplicateCheck duplicate = guard.checkDuplicatePurchase(userId, productType);
        if (duplicate.duplicate()) {
            reject("duplicate", PurchaseRejectedException.duplicate(duplicate.reason()), userId);
        }
        UserValidation validation = guard.validateUser(profile);
        if (!validation.valid()) {
            if (validation.requiresManualReview()) {
                Map<String, String> fields = new LinkedHashMap<>();
                fields.put("userId", userId);
                fields.put("username", profile.username());
                fields.put("reason", validation.reason());
                notifications.alertAdmin("Account needs review",
                        "A purchase was blocked pending manual account review.", fields);
            }
            reject("account", PurchaseRejectedException.accountRejected(validation.reason()), userId);
        }
    }

    private void reject(String metricReason, PurchaseRejectedException rejection, String userId) {
        metrics.recordGuardRejection(metricReason);
        log.info("Purchase by user {} rejected: {}", userId, rejection.getMessage());
        throw rejection;
    }

    private String checkoutUrl(String providerProductId, String userId, UUID intentId) {
        Map<String, String> customData = new LinkedHashMap<>();
        customData.put("userId", userId);
        customData.put("intentId", intentId.toString());
        try {
            String encoded = URLEncoder.encode(objectMapper.writeValueAsString(customData), StandardCharsets.UTF_8);
            return properties.getCheckoutBaseUrl() + "/" + providerProductId + "?custom_data=" + encoded;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode checkout custom data", e);
        }
    }
}
