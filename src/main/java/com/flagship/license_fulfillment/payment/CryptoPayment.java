package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A pending request for the user to send an exact crypto amount to a static
 * wallet. {@code expiresAt} is fixed at creation.
 */
@Value
public class CryptoPayment {
    UUID id;
    String userId;
    ProductType productType;
    CryptoAsset asset;
    BigDecimal cryptoAmount;
    BigDecimal usdAmount;
    String walletAddress;
    CryptoPaymentStatus status;
    Instant createdAt;
    Instant expiresAt;
    Instant updatedAt;
    String txid;

    public static CryptoPayment create(UUID id, String userId, ProductType productType, CryptoAsset asset,
                                       BigDecimal cryptoAmount, BigDecimal usdAmount, String walletAddress,
                                       Instant now, Duration paymentWindow) {
        return new CryptoPayment(id, userId, productType, asset, cryptoAmount, usdAmount, walletAddress,
                CryptoPaymentStatus.PENDING, now, now.plus(paymentWindow), now, null);
    }

    public CryptoPayment complete(String txid, Instant now) {
        requirePending(CryptoPaymentStatus.COMPLETED);
        return new CryptoPayment(id, userId, productType, asset, cryptoAmount, usdAmount, walletAddress,
                CryptoPaymentStatus.COMPLETED, createdAt, expiresAt, now, txid);
    }

    public CryptoPayment expire(Instant now) {
        requirePending(CryptoPaymentStatus.EXPIRED);
        return new CryptoPayment(id, userId, productType, asset, cryptoAmount, usdAmount, walletAddress,
                CryptoPaymentStatus.EXPIRED, createdAt, expiresAt, now, txid);
    }

    public boolean isPending() {
        return status == CryptoPaymentStatus.PENDING;
    }

    public boolean isTerminal() {
        return !isPending();
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    private void requirePending(CryptoPaymentStatus target) {
        if (!isPending()) {
            throw new IllegalStateException(
                    String.format("Cannot move crypto payment %s from %s to %s", id, status, target));
        }
    }
}
