package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.product.ProductType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * License domain object.
 *
 * A license is issued active and can only ever be deactivated, never
 * reactivated. The expiration date is fixed at issuance from the product's
 * duration. {@code userId} is null for unassigned, manually imported keys.
 */
@Value
public class License {
    UUID id;
    String licenseKey;
    String userId;
    ProductType productType;
    String sourcePaymentId;
    LicenseSource source;
    boolean active;
    Instant createdAt;
    Instant expirationDate;
    Instant deactivatedAt;
    DeactivationReason deactivationReason;
    String addedBy;

    public static License issue(String licenseKey, String userId, ProductType productType,
                                String sourcePaymentId, LicenseSource source, Instant now) {
        return issue(licenseKey, userId, productType, sourcePaymentId, source, now, null);
    }

    public static License issue(String licenseKey, String userId, ProductType productType,
                                String sourcePaymentId, LicenseSource source, Instant now, String addedBy) {
        return new License(
                UUID.randomUUID(),
                licenseKey,
                userId,
                productType,
                sourcePaymentId,
                source,
                true,
                now,
                now.plus(productType.getLicenseDuration()),
                null,
                null,
                addedBy
        );
    }

    /**
     * @throws IllegalStateException if the license is already inactive
     */
    public License deactivate(DeactivationReason reason, Instant now) {
        if (!active) {
            throw new IllegalStateException(
                    String.format("License %s is already inactive (%s)", licenseKey, deactivationReason));
        }
        return new License(id, licenseKey, userId, productType, sourcePaymentId, source,
                false, createdAt, expirationDate, now, reason, addedBy);
    }

    public boolean isExpiredAt(Instant now) {
        return expirationDate.isBefore(now);
    }

    /** Active and not past its expiration date. */
    public boolean isValidAt(Instant now) {
        return active && !isExpiredAt(now);
    }
}
