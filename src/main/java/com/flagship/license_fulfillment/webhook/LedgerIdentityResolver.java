package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.payment.PurchaseIntent;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves webhook payers against the purchase intents in the ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerIdentityResolver implements IdentityResolver {

    private final PaymentLedger ledger;
    private final FulfillmentProperties properties;

    @Override
    public Optional<ResolvedIdentity> resolveByToken(CustomData customData) {
        if (customData == null || customData.isEmpty()) {
            return Optional.empty();
        }

        Optional<PurchaseIntent> intent = parseIntentId(customData.intentId()).flatMap(ledger::findIntent);
        String userId = customData.userId();

        if (intent.isPresent()) {
            String owner = intent.get().getUserId();
            if (userId != null && !userId.equals(owner)) {
                log.warn("Custom data user {} does not own intent {} (owner {}); using the intent owner",
                        userId, intent.get().getId(), owner);
            }
            return Optional.of(new ResolvedIdentity(owner, intent.get().getId(), ResolvedIdentity.Confidence.TOKEN));
        }

        if (userId == null || userId.isBlank()) {
            log.warn("Custom data references unknown intent {} and carries no user id", customData.intentId());
            return Optional.empty();
        }
        if (customData.intentId() != null) {
            log.warn("Custom data references unknown intent {}; fulfilling for user {} without it",
                    customData.intentId(), userId);
        }
        return Optional.of(new ResolvedIdentity(userId, null, ResolvedIdentity.Confidence.TOKEN));
    }

    @Override
    public Optional<ResolvedIdentity> resolveByRecency(ProductType productType) {
        Optional<ResolvedIdentity> resolved = ledger.findCorrelatedIntent(productType, properties.getCorrelationWindow())
                .map(intent -> new ResolvedIdentity(intent.getUserId(), intent.getId(), ResolvedIdentity.Confidence.RECENCY));
        resolved.ifPresent(identity -> log.warn(
                "Payment for {} attributed to user {} by recency (intent {}); no correlation token present",
                productType.getCode(), identity.userId(), identity.intentId()));
        return resolved;
    }

    private static Optional<UUID> parseIntentId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed intent id '{}'", value);
            return Optional.empty();
        }
    }
}
