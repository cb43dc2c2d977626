package com.flagship.license_fulfillment.webhook;

import java.math.BigDecimal;

/**
 * The parts of a provider webhook the reconciler acts on.
 *
 * @param rawType the {@code type} field as sent, kept for logging unknown events
 */
public record ProviderEvent(
    ProviderEventType type,
    String rawType,
    String paymentId,
    String customerId,
    BigDecimal amount,
    String providerProductId,
    CustomData customData,
    String failureReason
) {
}
