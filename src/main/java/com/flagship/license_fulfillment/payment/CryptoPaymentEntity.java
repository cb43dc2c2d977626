package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.product.ProductType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code crypto_payments} table.
 */
@Entity
@Table(
    name = "crypto_payments",
    indexes = {
        @Index(name = "idx_crypto_payments_status_expires", columnList = "status, expires_at"),
        @Index(name = "idx_crypto_payments_user", columnList = "user_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CryptoPaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 32)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private CryptoAsset asset;

    @Column(name = "crypto_amount", nullable = false, updatable = false, precision = 24, scale = 8)
    private BigDecimal cryptoAmount;

    @Column(name = "usd_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal usdAmount;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 128)
    private String walletAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CryptoPaymentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(length = 128)
    private String txid;

    static CryptoPaymentEntity fromDomain(CryptoPayment payment) {
        return new CryptoPaymentEntity(
                payment.getId(),
                payment.getUserId(),
                payment.getProductType(),
                payment.getAsset(),
                payment.getCryptoAmount(),
                payment.getUsdAmount(),
                payment.getWalletAddress(),
                payment.getStatus(),
                payment.getCreatedAt(),
                payment.getExpiresAt(),
                payment.getUpdatedAt(),
                payment.getTxid()
        );
    }

    public CryptoPayment toDomain() {
        return new CryptoPayment(
                id,
                userId,
                productType,
                asset,
                cryptoAmount,
                usdAmount,
                walletAddress,
                status,
                createdAt,
                expiresAt,
                updatedAt,
                txid
        );
    }

    void updateFromDomain(CryptoPayment payment) {
        this.status = payment.getStatus();
        this.updatedAt = payment.getUpdatedAt();
        this.txid = payment.getTxid();
    }
}
