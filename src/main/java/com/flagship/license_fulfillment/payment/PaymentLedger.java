package com.flagship.license_fulfillment.payment;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable record of purchase intents and crypto payments.
 *
 * Every status change goes through a row lock ({@code SELECT ... FOR UPDATE})
 * followed by a status check, so a record leaves PENDING at most once even
 * when the webhook handler, the crypto monitor and the sweeper race on it.
 * Unknown ids and illegal transitions are logged no-ops, never exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedger {

    private final PurchaseIntentRepository intentRepository;
    private final CryptoPaymentRepository cryptoRepository;
    private final FulfillmentProperties properties;
    private final Clock clock;

    // ==================== Purchase intents ====================

    @Transactional
    public UUID createPendingFiat(String userId, ProductType productType, String providerProductId) {
        PurchaseIntent intent = PurchaseIntent.create(UUID.randomUUID(), userId, productType,
                providerProductId, clock.instant());
        intentRepository.save(PurchaseIntentEntity.fromDomain(intent));
        log.info("Recorded pending {} purchase intent {} for user {}", productType.getCode(), intent.getId(), userId);
        return intent.getId();
    }

    /**
     * Moves an intent to a new status and stamps the matching timestamp.
     *
     * @return the updated intent, or empty when the id is unknown or the
     *         transition is not allowed from the current status
     */
    @Transactional
    public Optional<PurchaseIntent> transition(UUID intentId, PurchaseIntentStatus newStatus, PurchaseIntentUpdate update) {
        Optional<PurchaseIntentEntity> entity = intentRepository.findByIdForUpdate(intentId);
        if (entity.isEmpty()) {
            log.warn("Ignoring transition to {} for unknown purchase intent {}", newStatus, intentId);
            return Optional.empty();
        }

        PurchaseIntent current = entity.get().toDomain();
        if (!current.canTransitionTo(newStatus)) {
            log.warn("Ignoring transition of purchase intent {} from {} to {}", intentId, current.getStatus(), newStatus);
            return Optional.empty();
        }

        PurchaseIntentUpdate extra = update == null ? PurchaseIntentUpdate.none() : update;
        Instant now = clock.instant();
        PurchaseIntent next = switch (newStatus) {
            case COMPLETED -> current.complete(extra.providerPaymentId(), extra.licenseKey(), now);
            case FAILED -> current.fail(extra.failureReason(), now);
            case REFUNDED -> current.refund(now);
            case PENDING -> throw new IllegalStateException("PENDING is not a transition target");
        };

        entity.get().updateFromDomain(next);
        intentRepository.save(entity.get());
        log.info("Purchase intent {} moved {} -> {}", intentId, current.getStatus(), newStatus);
        return Optional.of(next);
    }

    /**
     * Locks an intent for the remainder of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<PurchaseIntent> lockIntent(UUID intentId) {
        return intentRepository.findByIdForUpdate(intentId).map(PurchaseIntentEntity::toDomain);
    }

    /**
     * Most recent PENDING intent for the product created within the window.
     * This is a heuristic: with concurrent buyers of the same product it can
     * pick the wrong intent.
     */
    @Transactional(readOnly = true)
    public Optional<PurchaseIntent> findCorrelatedIntent(ProductType productType, Duration within) {
        Instant cutoff = clock.instant().minus(within);
        return intentRepository
                .findFirstByProductTypeAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
                    productType, PurchaseIntentStatus.PENDING, cutoff)
                .map(PurchaseIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseIntent> findIntent(UUID intentId) {
        return intentRepository.findById(intentId).map(PurchaseIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseIntent> findIntentByProviderPaymentId(String providerPaymentId) {
        return intentRepository.findFirstByProviderPaymentId(providerPaymentId).map(PurchaseIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean hasRecentPendingIntent(String userId, ProductType productType, Duration within) {
        return intentRepository.existsByUserIdAndProductTypeAndStatusAndCreatedAtAfter(
                userId, productType, PurchaseIntentStatus.PENDING, clock.instant().minus(within));
    }

    // ==================== Crypto payments ====================

    @Transactional
    public CryptoPayment createPendingCrypto(String userId, ProductType productType, CryptoAsset asset,
                                             BigDecimal cryptoAmount, BigDecimal usdAmount, String walletAddress) {
        CryptoPayment payment = CryptoPayment.create(UUID.randomUUID(), userId, productType, asset,
                cryptoAmount, usdAmount, walletAddress, clock.instant(), properties.getMonitor().getPaymentWindow());
        cryptoRepository.save(CryptoPaymentEntity.fromDomain(payment));
        log.info("Recorded pending {} payment {} of {} for user {} (expires {})",
                asset, payment.getId(), cryptoAmount.toPlainString(), userId, payment.getExpiresAt());
        return payment;
    }

    /**
     * Completes a pending crypto payment.
     *
     * @return the completed payment, or empty when it was unknown or no longer pending
     */
    @Transactional
    public Optional<CryptoPayment> completeCrypto(UUID paymentId, String txid) {
        return transitionCrypto(paymentId, CryptoPaymentStatus.COMPLETED,
                current -> current.complete(txid, clock.instant()));
    }

    /**
     * Expires a pending crypto payment.
     *
     * @return the expired payment, or empty when it was unknown or no longer pending
     */
    @Transactional
    public Optional<CryptoPayment> expireCrypto(UUID paymentId) {
        return transitionCrypto(paymentId, CryptoPaymentStatus.EXPIRED,
                current -> current.expire(clock.instant()));
    }

    @Transactional(readOnly = true)
    public Optional<CryptoPayment> findCryptoPayment(UUID paymentId) {
        return cryptoRepository.findById(paymentId).map(CryptoPaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<CryptoPayment> findLatestCryptoPayment(String userId) {
        return cryptoRepository.findFirstByUserIdOrderByCreatedAtDesc(userId).map(CryptoPaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<CryptoPayment> findPendingCryptoPayments() {
        return cryptoRepository.findByStatus(CryptoPaymentStatus.PENDING).stream()
                .map(CryptoPaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiredPendingCryptoPayments(Instant now) {
        return cryptoRepository.findPendingIdsExpiredBefore(now);
    }

    @Transactional(readOnly = true)
    public boolean hasOpenCryptoPayment(String userId, ProductType productType) {
        return cryptoRepository.existsByUserIdAndProductTypeAndStatusAndExpiresAtAfter(
                userId, productType, CryptoPaymentStatus.PENDING, clock.instant());
    }

    @Transactional(readOnly = true)
    public LedgerStats stats() {
        return new LedgerStats(
                intentRepository.countByStatus(PurchaseIntentStatus.PENDING),
                intentRepository.countByStatus(PurchaseIntentStatus.COMPLETED),
                intentRepository.countByStatus(PurchaseIntentStatus.FAILED),
                intentRepository.countByStatus(PurchaseIntentStatus.REFUNDED),
                cryptoRepository.countByStatus(CryptoPaymentStatus.PENDING),
                cryptoRepository.countByStatus(CryptoPaymentStatus.COMPLETED),
                cryptoRepository.countByStatus(CryptoPaymentStatus.EXPIRED)
        );
    }

    private Optional<CryptoPayment> transitionCrypto(UUID paymentId, CryptoPaymentStatus target,
                                                     UnaryOperator<CryptoPayment> change) {
        Optional<CryptoPaymentEntity> entity = cryptoRepository.findByIdForUpdate(paymentId);
        if (entity.isEmpty()) {
            log.warn("Ignoring {} for unknown crypto payment {}", target, paymentId);
            return Optional.empty();
        }
        CryptoPayment current = entity.get().toDomain();
        if (!current.isPending()) {
            log.debug("Crypto payment {} is already {}; skipping {}", paymentId, current.getStatus(), target);
            return Optional.empty();
        }
        CryptoPayment next = change.apply(current);
        entity.get().updateFromDomain(next);
        cryptoRepository.save(entity.get());
        log.info("Crypto payment {} moved PENDING -> {}", paymentId, target);
        return Optional.of(next);
    }
}
