package com.flagship.license_fulfillment.payment;

/**
 * Audit fields stamped alongside a purchase intent transition.
 */
public record PurchaseIntentUpdate(String providerPaymentId, String licenseKey, String failureReason) {

    public static PurchaseIntentUpdate none() {
        return new PurchaseIntentUpdate(null, null, null);
    }

    public static PurchaseIntentUpdate completed(String providerPaymentId, String licenseKey) {
        return new PurchaseIntentUpdate(providerPaymentId, licenseKey, null);
    }

    public static PurchaseIntentUpdate failed(String reason) {
        return new PurchaseIntentUpdate(null, null, reason);
    }
}
