package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.product.ProductType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseIntentRepository extends JpaRepository<PurchaseIntentEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseIntentEntity p WHERE p.id = :id")
    Optional<PurchaseIntentEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<PurchaseIntentEntity> findFirstByProviderPaymentId(String providerPaymentId);

    /**
     * Most recent intent for a product in the given status created after the cut-off.
     * Backs the recency correlation heuristic.
     */
    Optional<PurchaseIntentEntity> findFirstByProductTypeAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
        ProductType productType, PurchaseIntentStatus status, Instant createdAfter);

    boolean existsByUserIdAndProductTypeAndStatusAndCreatedAtAfter(
        String userId, ProductType productType, PurchaseIntentStatus status, Instant createdAfter);

    long countByStatus(PurchaseIntentStatus status);
}
