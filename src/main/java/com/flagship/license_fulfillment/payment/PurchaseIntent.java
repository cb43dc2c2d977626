package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.product.ProductType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's recorded intent to pay for a product through the hosted checkout.
 *
 * Only the webhook path moves an intent out of PENDING. Once completed the
 * intent keeps the provider payment id and the license key it produced.
 */
@Value
public class PurchaseIntent {
    UUID id;
    String userId;
    ProductType productType;
    String providerProductId;
    PurchaseIntentStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant failedAt;
    Instant refundedAt;
    String failureReason;
    String providerPaymentId;
    String licenseKey;

    public static PurchaseIntent create(UUID id, String userId, ProductType productType,
                                        String providerProductId, Instant now) {
        return new PurchaseIntent(id, userId, productType, providerProductId,
                PurchaseIntentStatus.PENDING, now, now, null, null, null, null, null, null);
    }

    public PurchaseIntent complete(String providerPaymentId, String licenseKey, Instant now) {
        requireTransition(PurchaseIntentStatus.COMPLETED);
        return new PurchaseIntent(id, userId, productType, providerProductId,
                PurchaseIntentStatus.COMPLETED, createdAt, now, now, failedAt, refundedAt,
                failureReason, providerPaymentId, licenseKey);
    }

    public PurchaseIntent fail(String reason, Instant now) {
        requireTransition(PurchaseIntentStatus.FAILED);
        return new PurchaseIntent(id, userId, productType, providerProductId,
                PurchaseIntentStatus.FAILED, createdAt, now, completedAt, now, refundedAt,
                reason, providerPaymentId, licenseKey);
    }

    public PurchaseIntent refund(Instant now) {
        requireTransition(PurchaseIntentStatus.REFUNDED);
        return new PurchaseIntent(id, userId, productType, providerProductId,
                PurchaseIntentStatus.REFUNDED, createdAt, now, completedAt, failedAt, now,
                failureReason, providerPaymentId, licenseKey);
    }

    public boolean isPending() {
        return status == PurchaseIntentStatus.PENDING;
    }

    public boolean canTransitionTo(PurchaseIntentStatus target) {
        return switch (status) {
            case PENDING -> target == PurchaseIntentStatus.COMPLETED || target == PurchaseIntentStatus.FAILED;
            case COMPLETED -> target == PurchaseIntentStatus.REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }

    private void requireTransition(PurchaseIntentStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                    String.format("Cannot move purchase intent %s from %s to %s", id, status, target));
        }
    }
}
