package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.fulfillment.FulfillmentOutcome;
import com.flagship.license_fulfillment.fulfillment.FulfillmentService;
import com.flagship.license_fulfillment.notification.NotificationDispatcher;
import com.flagship.license_fulfillment.observability.CorrelationContext;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.product.ProductCatalog;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns verified provider webhooks into license, failure and refund
 * transitions.
 *
 * Every delivery of the same successful payment converges on at most one
 * license: replays are detected through {@link WebhookIdempotencyService},
 * the intent's PENDING check, and finally the unique constraint on the
 * license's source payment id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final ProviderEventParser parser;
    private final ProductCatalog productCatalog;
    private final IdentityResolver identityResolver;
    private final WebhookIdempotencyService idempotencyService;
    private final FulfillmentService fulfillmentService;
    private final NotificationDispatcher notifications;
    private final FulfillmentMetrics metrics;

    /**
     * @throws InvalidSignatureException if the signature does not match the body
     * @throws IllegalArgumentException  if the body is not a JSON object
     */
    public WebhookOutcome handle(byte[] rawBody, String signature) {
        signatureVerifier.verifyOrThrow(rawBody, signature);
        ProviderEvent event = parser.parse(rawBody);
        CorrelationContext.tagPayment(event.paymentId(), event.customData().userId());

        WebhookOutcome outcome = switch (event.type()) {
            case PAYMENT_SUCCESS -> handleSuccess(event);
            case PAYMENT_FAILED -> handleFailure(event);
            case PAYMENT_REFUNDED -> handleRefund(event);
            case UNKNOWN -> {
                log.info("Ignoring webhook event of type '{}'", event.rawType());
                yield WebhookOutcome.IGNORED;
            }
        };
        metrics.recordWebhook(event.type().getWireName(), outcome.name());
        return outcome;
    }

    private WebhookOutcome handleSuccess(ProviderEvent event) {
        Optional<ProductType> productType = productCatalog.findByProviderProductId(event.providerProductId());
        if (productType.isEmpty()) {
            log.error("Payment {} is for unknown provider product '{}'; not fulfilling",
                    event.paymentId(), event.providerProductId());
            return WebhookOutcome.UNKNOWN_PRODUCT;
        }
        if (event.paymentId() == null) {
            log.error("Successful payment for {} carries no payment id; cannot fulfill idempotently",
                    productType.get().getCode());
            return WebhookOutcome.IGNORED;
        }
        if (idempotencyService.isAlreadyFulfilled(event.paymentId())) {
            log.info("Payment {} was already fulfilled; acknowledging replay", event.paymentId());
            return WebhookOutcome.DUPLICATE;
        }

        Optional<ResolvedIdentity> identity = identityResolver.resolve(event.customData(), productType.get());
        if (identity.isEmpty()) {
            log.error("Could not determine the buyer for payment {} ({}); manual fulfillment required",
                    event.paymentId(), productType.get().getCode());
            metrics.recordUnresolvedWebhook();
            notifications.alertAdmin("Unresolvable payment",
                    "A payment could not be matched to a user and needs manual fulfillment.",
                    paymentFields(event, productType.get()));
            return WebhookOutcome.UNRESOLVED;
        }

        ResolvedIdentity resolved = identity.get();
        metrics.recordCorrelation(resolved.confidence().name());
        try {
            FulfillmentOutcome outcome = fulfillmentService.fulfillFiat(resolved.userId(), resolved.intentId(),
                    productType.get(), event.paymentId());
            if (!outcome.isFulfilled()) {
                return WebhookOutcome.DUPLICATE;
            }
            idempotencyService.markFulfilled(event.paymentId());
            log.info("Fulfilled payment {} for user {} ({} confidence)",
                    event.paymentId(), resolved.userId(), resolved.confidence());
            return WebhookOutcome.FULFILLED;
        } catch (DataIntegrityViolationException e) {
            log.info("Payment {} was fulfilled concurrently; treating delivery as a replay", event.paymentId());
            return WebhookOutcome.DUPLICATE;
        }
    }

    private WebhookOutcome handleFailure(ProviderEvent event) {
        UUID intentId = identityResolver.resolveByToken(event.customData())
                .map(ResolvedIdentity::intentId)
                .orElse(null);
        String userId = event.customData().userId() != null ? event.customData().userId() : event.customerId();
        log.info("Payment {} failed: {}", event.paymentId(), event.failureReason());
        fulfillmentService.failIntent(intentId, userId, event.failureReason());
        return WebhookOutcome.PAYMENT_FAILED;
    }

    private WebhookOutcome handleRefund(ProviderEvent event) {
        if (event.paymentId() == null) {
            log.error("Refund webhook carries no payment id; nothing to revoke");
            return WebhookOutcome.IGNORED;
        }
        log.info("Payment {} refunded", event.paymentId());
        fulfillmentService.refund(event.paymentId());
        return WebhookOutcome.REFUNDED;
    }

    private static Map<String, String> paymentFields(ProviderEvent event, ProductType productType) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("paymentId", event.paymentId());
        fields.put("product", productType.getDisplayName());
        if (event.customerId() != null) {
            fields.put("customerId", event.customerId());
        }
        if (event.amount() != null) {
            fields.put("amount", event.amount().toPlainString());
        }
        return fields;
    }
}
