package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.product.ProductType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LicenseRepository extends JpaRepository<LicenseEntity, UUID> {

    Optional<LicenseEntity> findByLicenseKey(String licenseKey);

    boolean existsByLicenseKey(String licenseKey);

    boolean existsBySourcePaymentId(String sourcePaymentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LicenseEntity l WHERE l.sourcePaymentId = :sourcePaymentId")
    Optional<LicenseEntity> findBySourcePaymentIdForUpdate(@Param("sourcePaymentId") String sourcePaymentId);

    List<LicenseEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<LicenseEntity> findByLicenseKeyIn(Collection<String> licenseKeys);

    /**
     * Active licenses for a user and product that have not yet passed their
     * expiration date. Used by the duplicate-purchase guard.
     */
    @Query("""
        SELECT CASE WHEN COUNT(l) > 0 THEN true ELSE false END FROM LicenseEntity l
        WHERE l.userId = :userId
        AND l.productType = :productType
        AND l.active = true
        AND l.expirationDate > :now
        """)
    boolean existsActiveUnexpired(@Param("userId") String userId,
                                  @Param("productType") ProductType productType,
                                  @Param("now") Instant now);

    /**
     * Active licenses whose expiration date has passed, locked for the sweep.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT l FROM LicenseEntity l
        WHERE l.active = true AND l.expirationDate < :now
        """)
    List<LicenseEntity> findActiveExpiredBefore(@Param("now") Instant now);

    long countByActiveTrue();
}
