package com.flagship.license_fulfillment.webhook;

/**
 * How a verified webhook delivery was handled. All of these are acknowledged
 * with 200 so the provider stops retrying.
 */
public enum WebhookOutcome {
    FULFILLED,
    DUPLICATE,
    PAYMENT_FAILED,
    REFUNDED,
    UNKNOWN_PRODUCT,
    UNRESOLVED,
    IGNORED
}
