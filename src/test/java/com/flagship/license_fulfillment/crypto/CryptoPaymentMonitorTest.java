package com.flagship.license_fulfillment.crypto;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.fulfillment.FulfillmentService;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.license.LicenseSource;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.support.MutableClock;
import com.flagship.license_fulfillment.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CryptoPaymentMonitorTest {

    private static final String USER = "123456789012345678";
    private static final BigDecimal AMOUNT = new BigDecimal("0.00013846");

    private MutableClock clock;
    private PaymentLedger ledger;
    private FulfillmentService fulfillmentService;
    private TaskScheduler taskScheduler;
    private ChainDataSource btcSource;
    private FulfillmentProperties properties;
    private CryptoPaymentMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        ledger = mock(PaymentLedger.class);
        fulfillmentService = mock(FulfillmentService.class);
        taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.getClock()).thenReturn(clock);
        btcSource = mock(ChainDataSource.class);
        when(btcSource.asset()).thenReturn(CryptoAsset.BTC);

        properties = TestProperties.fulfillmentProperties();
        properties.getMonitor().setMaxPolls(3);
        monitor = new CryptoPaymentMonitor(ledger, fulfillmentService, taskScheduler,
                new FulfillmentMetrics(new SimpleMeterRegistry()), List.of(btcSource), properties, clock);
    }

    private CryptoPayment pendingPayment() {
        CryptoPayment payment = CryptoPayment.create(UUID.randomUUID(), USER, ProductType.MONTHLY, CryptoAsset.BTC,
                AMOUNT, new BigDecimal("9.00"), TestProperties.BTC_WALLET, clock.instant(), Duration.ofMinutes(30));
        when(ledger.findCryptoPayment(payment.getId())).thenReturn(Optional.of(payment));
        return payment;
    }

    private ChainTransaction paying(String txid, BigDecimal amount) {
        return new ChainTransaction(txid, clock.instant().plusSeconds(30), true,
                List.of(new ChainOutput(TestProperties.BTC_WALLET, amount)));
    }

    @Test
    @DisplayName("A matching transaction fulfills the payment and stops monitoring")
    void pollOnce_MatchFulfills() {
        CryptoPayment payment = pendingPayment();
        when(btcSource.fetchTransactions(TestProperties.BTC_WALLET)).thenReturn(List.of(paying("tx-1", AMOUNT)));
        License license = License.issue("MONTHLY-0123456789ABCDEF", USER, ProductType.MONTHLY,
                payment.getId().toString(), LicenseSource.CRYPTO, clock.instant());
        when(fulfillmentService.fulfillCrypto(eq(payment.getId()), any())).thenReturn(Optional.of(license));

        monitor.start(payment.getId());
        assertTrue(monitor.isMonitoring(payment.getId()));

        PollOutcome outcome = monitor.pollOnce(payment.getId());

        assertEquals(PollOutcome.MATCHED, outcome);
        assertFalse(monitor.isMonitoring(payment.getId()));
        verify(fulfillmentService).fulfillCrypto(payment.getId(), new TransactionMatch("tx-1", AMOUNT, true));
    }

    @Test
    @DisplayName("A match for a payment already completed elsewhere closes the watch without a second license")
    void pollOnce_SecondMatchIsNoOp() {
        CryptoPayment payment = pendingPayment();
        when(btcSource.fetchTransactions(anyString())).thenReturn(List.of(paying("tx-1", AMOUNT)));
        when(fulfillmentService.fulfillCrypto(eq(payment.getId()), any())).thenReturn(Optional.empty());

        assertEquals(PollOutcome.CLOSED, monitor.pollOnce(payment.getId()));
    }

    @Test
    @DisplayName("A payment that is no longer pending is not polled")
    void pollOnce_TerminalPaymentClosed() {
        CryptoPayment payment = pendingPayment().complete("tx-9", clock.instant());
        when(ledger.findCryptoPayment(payment.getId())).thenReturn(Optional.of(payment));

        assertEquals(PollOutcome.CLOSED, monitor.pollOnce(payment.getId()));
        verifyNoInteractions(btcSource);
        verifyNoInteractions(fulfillmentService);
    }

    @Test
    @DisplayName("Once the payment window has passed the payment is expired instead of polled")
    void pollOnce_WindowElapsedExpires() {
        CryptoPayment payment = pendingPayment();
        when(fulfillmentService.expireCrypto(payment.getId(), "window_elapsed")).thenReturn(true);
        monitor.start(payment.getId());

        clock.advance(Duration.ofMinutes(31));

        assertEquals(PollOutcome.EXPIRED, monitor.pollOnce(payment.getId()));
        assertFalse(monitor.isMonitoring(payment.getId()));
        verifyNoInteractions(btcSource);
    }

    @Test
    @DisplayName("Reaching the poll cap without a match expires the payment")
    void pollOnce_PollCapExpires() {
        CryptoPayment payment = pendingPayment();
        when(btcSource.fetchTransactions(anyString())).thenReturn(List.of(paying("other", new BigDecimal("0.5"))));
        when(fulfillmentService.expireCrypto(payment.getId(), "poll_limit")).thenReturn(true);
        monitor.start(payment.getId());

        assertEquals(PollOutcome.WAITING, monitor.pollOnce(payment.getId()));
        assertEquals(PollOutcome.WAITING, monitor.pollOnce(payment.getId()));
        assertEquals(PollOutcome.EXPIRED, monitor.pollOnce(payment.getId()));

        assertFalse(monitor.isMonitoring(payment.getId()));
        verify(fulfillmentService).expireCrypto(payment.getId(), "poll_limit");
    }

    @Test
    @DisplayName("An explorer failure is retried on the next tick")
    void pollOnce_ChainErrorKeepsWatching() {
        CryptoPayment payment = pendingPayment();
        when(btcSource.fetchTransactions(anyString())).thenThrow(new ChainDataException("rate limited"));
        monitor.start(payment.getId());

        assertEquals(PollOutcome.ERROR, monitor.pollOnce(payment.getId()));
        assertTrue(monitor.isMonitoring(payment.getId()));
    }

    @Test
    @DisplayName("Starting a watch twice schedules one task")
    void start_Idempotent() {
        UUID id = UUID.randomUUID();

        monitor.start(id);
        monitor.start(id);

        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(30)));
        assertEquals(1, monitor.activeCount());
    }

    @Test
    @DisplayName("Startup resumes pending payments and expires those whose window has passed")
    void resumePendingPayments_ResumesAndExpires() {
        CryptoPayment live = pendingPayment();
        CryptoPayment stale = CryptoPayment.create(UUID.randomUUID(), USER, ProductType.LIFETIME, CryptoAsset.BTC,
                AMOUNT, new BigDecimal("21.00"), TestProperties.BTC_WALLET,
                clock.instant().minus(Duration.ofHours(2)), Duration.ofMinutes(30));
        when(ledger.findPendingCryptoPayments()).thenReturn(List.of(live, stale));

        monitor.resumePendingPayments();

        assertTrue(monitor.isMonitoring(live.getId()));
        assertFalse(monitor.isMonitoring(stale.getId()));
        verify(fulfillmentService).expireCrypto(stale.getId(), "window_elapsed");
    }
}
