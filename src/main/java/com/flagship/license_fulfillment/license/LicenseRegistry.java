package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.product.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Issues licenses and drives their active → inactive lifecycle.
 *
 * Issuance is keyed by the source payment id: a second issue for the same
 * payment is rejected, and the {@code source_payment_id} unique constraint
 * backs this up at the database level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LicenseRegistry {

    private static final int MAX_KEY_ATTEMPTS = 5;
    private static final Pattern USER_ID_PATTERN = Pattern.compile("^\\d{17,19}$");
    private static final String MANUAL_PAYMENT_PREFIX = "manual-";

    private final LicenseRepository repository;
    private final LicenseKeyCodec keyCodec;
    private final Clock clock;

    /**
     * Issues a fresh license for a fulfilled payment.
     *
     * @throws IllegalStateException if a license already exists for the payment
     */
    @Transactional
    public License issue(String userId, ProductType productType, String sourcePaymentId, LicenseSource source) {
        if (sourcePaymentId == null || sourcePaymentId.isBlank()) {
            throw new IllegalArgumentException("Source payment id is required");
        }
        if (repository.existsBySourcePaymentId(sourcePaymentId)) {
            throw new IllegalStateException("License already issued for payment " + sourcePaymentId);
        }

        License license = License.issue(uniqueKey(userId, productType), userId, productType,
                sourcePaymentId, source, clock.instant());
        repository.save(LicenseEntity.fromDomain(license));

        log.info("Issued {} license {} for user {} (source={}, payment={}, expires={})",
                productType.getCode(), license.getLicenseKey(), userId, source, sourcePaymentId,
                license.getExpirationDate());
        return license;
    }

    @Transactional(readOnly = true)
    public boolean isIssuedFor(String sourcePaymentId) {
        return repository.existsBySourcePaymentId(sourcePaymentId);
    }

    @Transactional(readOnly = true)
    public Optional<License> findByKey(String licenseKey) {
        return repository.findByLicenseKey(licenseKey).map(LicenseEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<License> findByUser(String userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(LicenseEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasActiveLicense(String userId, ProductType productType) {
        return repository.existsActiveUnexpired(userId, productType, clock.instant());
    }

    /**
     * Deactivated keys are reported as not found, matching what a client
     * should see for a revoked key.
     */
    @Transactional(readOnly = true)
    public LicenseValidation validate(String licenseKey) {
        Optional<License> license = findByKey(licenseKey).filter(License::isActive);
        if (license.isEmpty()) {
            return LicenseValidation.notFound();
        }
        if (license.get().isExpiredAt(clock.instant())) {
            return LicenseValidation.expired(license.get());
        }
        return LicenseValidation.valid(license.get());
    }

    /**
     * Deactivates the license issued for a refunded payment.
     *
     * @return the deactivated license, or empty if none was issued or it was already inactive
     */
    @Transactional
    public Optional<License> deactivateForRefund(String sourcePaymentId) {
        Optional<LicenseEntity> entity = repository.findBySourcePaymentIdForUpdate(sourcePaymentId);
        if (entity.isEmpty()) {
            log.warn("Refund for payment {} has no license to deactivate", sourcePaymentId);
            return Optional.empty();
        }
        License current = entity.get().toDomain();
        if (!current.isActive()) {
            log.info("License {} for refunded payment {} is already inactive", current.getLicenseKey(), sourcePaymentId);
            return Optional.empty();
        }
        License deactivated = current.deactivate(DeactivationReason.REFUNDED, clock.instant());
        entity.get().updateFromDomain(deactivated);
        repository.save(entity.get());
        log.info("Deactivated license {} after refund of payment {}", deactivated.getLicenseKey(), sourcePaymentId);
        return Optional.of(deactivated);
    }

    /**
     * Deactivates every active license whose expiration date has passed.
     *
     * @return the licenses that were deactivated in this pass
     */
    @Transactional
    public List<License> expireOverdue() {
        Instant now = clock.instant();
        List<License> expired = new ArrayList<>();
        for (LicenseEntity entity : repository.findActiveExpiredBefore(now)) {
            License deactivated = entity.toDomain().deactivate(DeactivationReason.EXPIRED, now);
            entity.updateFromDomain(deactivated);
            repository.save(entity);
            expired.add(deactivated);
        }
        if (!expired.isEmpty()) {
            log.info("Deactivated {} expired licenses", expired.size());
        }
        return expired;
    }

    /**
     * Imports administrator-supplied keys as active licenses.
     *
     * @param userId owner of the keys, or null/blank for unassigned keys
     * @throws DuplicateLicenseKeyException if any key already exists
     * @throws IllegalArgumentException on an empty batch or malformed user id
     */
    @Transactional
    public List<License> importKeys(List<String> rawKeys, ProductType productType, String userId, String addedBy) {
        Set<String> keys = new LinkedHashSet<>();
        for (String raw : rawKeys == null ? List.<String>of() : rawKeys) {
            if (raw != null && !raw.isBlank()) {
                keys.add(raw.trim());
            }
        }
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("No valid license keys provided");
        }
        String owner = userId == null || userId.isBlank() ? null : userId.trim();
        if (owner != null && !USER_ID_PATTERN.matcher(owner).matches()) {
            throw new IllegalArgumentException("Invalid user ID format. User ID should be 17-19 digits");
        }

        List<String> duplicates = repository.findByLicenseKeyIn(keys).stream()
                .map(LicenseEntity::getLicenseKey)
                .toList();
        if (!duplicates.isEmpty()) {
            throw new DuplicateLicenseKeyException(duplicates);
        }

        Instant now = clock.instant();
        List<License> imported = new ArrayList<>();
        for (String key : keys) {
            License license = License.issue(key, owner, productType,
                    MANUAL_PAYMENT_PREFIX + UUID.randomUUID(), LicenseSource.MANUAL, now, addedBy);
            repository.save(LicenseEntity.fromDomain(license));
            imported.add(license);
        }
        log.info("Imported {} {} keys (assigned to {}) by {}", imported.size(), productType.getCode(),
                owner == null ? "nobody" : owner, addedBy);
        return imported;
    }

    public boolean verifyFormat(String licenseKey, ProductType productType) {
        return keyCodec.verifyFormat(licenseKey, productType);
    }

    @Transactional(readOnly = true)
    public long countAll() {
        return repository.count();
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return repository.countByActiveTrue();
    }

    private String uniqueKey(String userId, ProductType productType) {
        for (int attempt = 0; attempt < MAX_KEY_ATTEMPTS; attempt++) {
            String candidate = keyCodec.generate(userId, productType);
            if (!repository.existsByLicenseKey(candidate)) {
                return candidate;
            }
            log.warn("License key collision on attempt {}; regenerating", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique license key");
    }
}
