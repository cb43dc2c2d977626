package com.flagship.license_fulfillment.crypto;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.config.SchedulingConfig;
import com.flagship.license_fulfillment.fulfillment.FulfillmentService;
import com.flagship.license_fulfillment.observability.CorrelationContext;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls block explorers for each pending crypto payment until it is paid,
 * expires, or runs out of polls.
 *
 * One scheduled task per payment id. The chain lookup runs outside any
 * transaction; only the final complete/expire step takes the row lock, and
 * its PENDING check makes a second matching transaction a no-op.
 */
@Component
@Slf4j
public class CryptoPaymentMonitor {

    private final PaymentLedger ledger;
    private final FulfillmentService fulfillmentService;
    private final TaskScheduler taskScheduler;
    private final FulfillmentMetrics metrics;
    private final FulfillmentProperties.Monitor settings;
    private final Clock clock;
    private final Map<CryptoAsset, ChainDataSource> sources = new EnumMap<>(CryptoAsset.class);
    private final Map<UUID, Watch> watches = new ConcurrentHashMap<>();

    public CryptoPaymentMonitor(PaymentLedger ledger,
                                FulfillmentService fulfillmentService,
                                @Qualifier(SchedulingConfig.CRYPTO_MONITOR_SCHEDULER) TaskScheduler taskScheduler,
                                FulfillmentMetrics metrics,
                                List<ChainDataSource> chainDataSources,
                                FulfillmentProperties properties,
                                Clock clock) {
        this.ledger = ledger;
        this.fulfillmentService = fulfillmentService;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.settings = properties.getMonitor();
        this.clock = clock;
        for (ChainDataSource source : chainDataSources) {
            sources.put(source.asset(), source);
        }
    }

    /**
     * Starts polling for a payment. Calling it again for a payment that is
     * already being watched does nothing.
     */
    public void start(UUID paymentId) {
        Watch watch = new Watch();
        if (watches.putIfAbsent(paymentId, watch) != null) {
            log.debug("Crypto payment {} is already being monitored", paymentId);
            return;
        }
        Duration interval = settings.getPollInterval();
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(
                () -> tick(paymentId), taskScheduler.getClock().instant().plus(interval), interval);
        watch.attach(future);
        log.info("Started monitoring crypto payment {} (every {}, at most {} polls)",
                paymentId, interval, settings.getMaxPolls());
    }

    /**
     * Re-arms monitoring for payments that were pending when the service last
     * stopped. Payments whose window passed in the meantime are expired now.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumePendingPayments() {
        if (!settings.isResumeOnStartup()) {
            return;
        }
        Instant now = clock.instant();
        int resumed = 0;
        for (CryptoPayment payment : ledger.findPendingCryptoPayments()) {
            if (payment.isExpiredAt(now)) {
                fulfillmentService.expireCrypto(payment.getId(), "window_elapsed");
            } else {
                start(payment.getId());
                resumed++;
            }
        }
        if (resumed > 0) {
            log.info("Resumed monitoring for {} pending crypto payments", resumed);
        }
    }

    /**
     * Runs one poll for the payment and stops its task when the outcome is terminal
     * or the poll cap is reached.
     */
    public PollOutcome pollOnce(UUID paymentId) {
        Watch watch = watches.get(paymentId);
        int polls = watch == null ? 1 : watch.polls.incrementAndGet();

        PollOutcome outcome = check(paymentId);
        if (!outcome.isTerminal() && polls >= settings.getMaxPolls()) {
            log.info("Crypto payment {} reached {} polls without a match", paymentId, polls);
            outcome = fulfillmentService.expireCrypto(paymentId, "poll_limit") ? PollOutcome.EXPIRED : PollOutcome.CLOSED;
        }
        if (outcome.isTerminal()) {
            stop(paymentId);
        }
        return outcome;
    }

    public boolean isMonitoring(UUID paymentId) {
        return watches.containsKey(paymentId);
    }

    public int activeCount() {
        return watches.size();
    }

    @PreDestroy
    public void shutdown() {
        watches.keySet().forEach(this::stop);
    }

    private void tick(UUID paymentId) {
        CorrelationContext.begin("poll");
        try {
            pollOnce(paymentId);
        } catch (RuntimeException e) {
            log.error("Unexpected error monitoring crypto payment {}", paymentId, e);
        } finally {
            CorrelationContext.clear();
        }
    }

    private PollOutcome check(UUID paymentId) {
        Optional<CryptoPayment> found = ledger.findCryptoPayment(paymentId);
        if (found.isEmpty() || !found.get().isPending()) {
            return PollOutcome.CLOSED;
        }
        CryptoPayment payment = found.get();
        CorrelationContext.tagPayment(paymentId, payment.getUserId());

        if (payment.isExpiredAt(clock.instant())) {
            return fulfillmentService.expireCrypto(paymentId, "window_elapsed") ? PollOutcome.EXPIRED : PollOutcome.CLOSED;
        }

        ChainDataSource source = sources.get(payment.getAsset());
        if (source == null) {
            log.error("No chain data source for {}; cannot monitor payment {}", payment.getAsset(), paymentId);
            metrics.recordCryptoPoll(payment.getAsset().name(), "error");
            return PollOutcome.ERROR;
        }

        List<ChainTransaction> transactions;
        try {
            transactions = source.fetchTransactions(payment.getWalletAddress());
        } catch (ChainDataException e) {
            log.warn("Poll for crypto payment {} failed: {}", paymentId, e.getMessage());
            metrics.recordCryptoPoll(payment.getAsset().name(), "error");
            return PollOutcome.ERROR;
        }

        Optional<TransactionMatch> match = TransactionMatcher.findMatchingTransaction(transactions,
                payment.getWalletAddress(), payment.getCryptoAmount(), settings.getAmountTolerance(), payment.getCreatedAt());
        if (match.isEmpty()) {
            metrics.recordCryptoPoll(payment.getAsset().name(), "waiting");
            return PollOutcome.WAITING;
        }

        metrics.recordCryptoPoll(payment.getAsset().name(), "matched");
        log.info("Found transaction {} paying crypto payment {}", match.get().txid(), paymentId);
        return fulfillmentService.fulfillCrypto(paymentId, match.get()).isPresent()
                ? PollOutcome.MATCHED
                : PollOutcome.CLOSED;
    }

    private void stop(UUID paymentId) {
        Watch watch = watches.remove(paymentId);
        if (watch != null) {
            watch.cancel();
        }
    }

    private static final class Watch {
        final AtomicInteger polls = new AtomicInteger();
        private ScheduledFuture<?> future;
        private boolean cancelled;

        synchronized void attach(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled && scheduled != null) {
                scheduled.cancel(false);
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
