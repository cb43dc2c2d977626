package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.product.ProductType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CryptoPaymentRepository extends JpaRepository<CryptoPaymentEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CryptoPaymentEntity c WHERE c.id = :id")
    Optional<CryptoPaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    List<CryptoPaymentEntity> findByStatus(CryptoPaymentStatus status);

    @Query("""
        SELECT c.id FROM CryptoPaymentEntity c
        WHERE c.status = com.flagship.license_fulfillment.payment.CryptoPaymentStatus.PENDING
        AND c.expiresAt < :now
        ORDER BY c.expiresAt ASC
        """)
    List<UUID> findPendingIdsExpiredBefore(@Param("now") Instant now);

    Optional<CryptoPaymentEntity> findFirstByUserIdOrderByCreatedAtDesc(String userId);

    boolean existsByUserIdAndProductTypeAndStatusAndExpiresAtAfter(
        String userId, ProductType productType, CryptoPaymentStatus status, Instant now);

    long countByStatus(CryptoPaymentStatus status);
}
