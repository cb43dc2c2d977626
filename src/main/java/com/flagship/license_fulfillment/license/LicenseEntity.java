package com.flagship.license_fulfillment.license;

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
 * JPA entity for the {@code licenses} table.
 *
 * No setters: the only mutation is {@link #updateFromDomain(License)}, which
 * copies the deactivation fields. Key, owner, product, source payment and
 * expiration date are insert-only.
 */
@Entity
@Table(
    name = "licenses",
    indexes = {
        @Index(name = "idx_licenses_user_product", columnList = "user_id, product_type"),
        @Index(name = "idx_licenses_active_expiration", columnList = "is_active, expiration_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LicenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "license_key", nullable = false, unique = true, updatable = false, length = 64)
    private String licenseKey;

    @Column(name = "user_id", updatable = false, length = 32)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Column(name = "source_payment_id", nullable = false, unique = true, updatable = false)
    private String sourcePaymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private LicenseSource source;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expiration_date", nullable = false, updatable = false)
    private Instant expirationDate;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "deactivation_reason", length = 20)
    private DeactivationReason deactivationReason;

    @Column(name = "added_by", updatable = false, length = 64)
    private String addedBy;

    static LicenseEntity fromDomain(License license) {
        return new LicenseEntity(
                license.getId(),
                license.getLicenseKey(),
                license.getUserId(),
                license.getProductType(),
                license.getSourcePaymentId(),
                license.getSource(),
                license.isActive(),
                license.getCreatedAt(),
                license.getExpirationDate(),
                license.getDeactivatedAt(),
                license.getDeactivationReason(),
                license.getAddedBy()
        );
    }

    public License toDomain() {
        return new License(
                id,
                licenseKey,
                userId,
                productType,
                sourcePaymentId,
                source,
                active,
                createdAt,
                expirationDate,
                deactivatedAt,
                deactivationReason,
                addedBy
        );
    }

    void updateFromDomain(License license) {
        if (!this.active && license.isActive()) {
            throw new IllegalStateException("License " + licenseKey + " cannot be reactivated");
        }
        this.active = license.isActive();
        this.deactivatedAt = license.getDeactivatedAt();
        this.deactivationReason = license.getDeactivationReason();
    }
}
