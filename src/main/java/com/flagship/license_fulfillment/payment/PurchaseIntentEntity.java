package com.flagship.license_fulfillment.payment;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code purchase_intents} table.
 */
@Entity
@Table(
    name = "purchase_intents",
    indexes = {
        @Index(name = "idx_purchase_intents_status_product", columnList = "status, product_type, created_at"),
        @Index(name = "idx_purchase_intents_user", columnList = "user_id, product_type"),
        @Index(name = "idx_purchase_intents_provider_payment", columnList = "provider_payment_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseIntentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 32)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Column(name = "provider_product_id", nullable = false, updatable = false)
    private String providerProductId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PurchaseIntentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "provider_payment_id")
    private String providerPaymentId;

    @Column(name = "license_key", length = 64)
    private String licenseKey;

    static PurchaseIntentEntity fromDomain(PurchaseIntent intent) {
        return new PurchaseIntentEntity(
                intent.getId(),
                intent.getUserId(),
                intent.getProductType(),
                intent.getProviderProductId(),
                intent.getStatus(),
                intent.getCreatedAt(),
                intent.getUpdatedAt(),
                intent.getCompletedAt(),
                intent.getFailedAt(),
                intent.getRefundedAt(),
                intent.getFailureReason(),
                intent.getProviderPaymentId(),
                intent.getLicenseKey()
        );
    }

    public PurchaseIntent toDomain() {
        return new PurchaseIntent(
                id,
                userId,
                productType,
                providerProductId,
                status,
                createdAt,
                updatedAt,
                completedAt,
                failedAt,
                refundedAt,
                failureReason,
                providerPaymentId,
                licenseKey
        );
    }

    /**
     * Copies status and audit fields. Identity, owner and product never change.
     */
    void updateFromDomain(PurchaseIntent intent) {
        this.status = intent.getStatus();
        this.updatedAt = intent.getUpdatedAt();
        this.completedAt = intent.getCompletedAt();
        this.failedAt = intent.getFailedAt();
        this.refundedAt = intent.getRefundedAt();
        this.failureReason = intent.getFailureReason();
        this.providerPaymentId = intent.getProviderPaymentId();
        this.licenseKey = intent.getLicenseKey();
    }
}
