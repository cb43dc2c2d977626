package com.flagship.license_fulfillment.purchase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.crypto.CryptoPaymentMonitor;
import com.flagship.license_fulfillment.crypto.PriceOracle;
import com.flagship.license_fulfillment.guard.AntiAbuseGuard;
import com.flagship.license_fulfillment.guard.PurchaseRejectedException;
import com.flagship.license_fulfillment.guard.UserProfile;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.notification.NotificationDispatcher;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.product.ProductCatalog;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.purchase.dto.CheckoutResponse;
import com.flagship.license_fulfillment.support.MutableClock;
import com.flagship.license_fulfillment.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PurchaseServiceTest {

    private static final String USER = "123456789012345678";

    private MutableClock clock;
    private PaymentLedger ledger;
    private LicenseRegistry licenseRegistry;
    private PriceOracle priceOracle;
    private CryptoPaymentMonitor monitor;
    private NotificationDispatcher notifications;
    private FulfillmentProperties properties;
    private PurchaseService service;
    private UserProfile trustedUser;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        ledger = mock(PaymentLedger.class);
        licenseRegistry = mock(LicenseRegistry.class);
        priceOracle = mock(PriceOracle.class);
        monitor = mock(CryptoPaymentMonitor.class);
        notifications = mock(NotificationDispatcher.class);
        properties = TestProperties.fulfillmentProperties();

        service = new PurchaseService(
                new AntiAbuseGuard(ledger, licenseRegistry, properties, clock),
                ledger,
                new ProductCatalog(properties),
                priceOracle,
                monitor,
                notifications,
                new FulfillmentMetrics(new SimpleMeterRegistry()),
                properties,
                new ObjectMapper());
        trustedUser = new UserProfile("alice", "a1b2c3", clock.instant().minus(Duration.ofDays(365)));
    }

    @Test
    @DisplayName("Fiat purchase records an intent and embeds user and intent in the checkout link")
    void startFiatPurchase_BuildsCheckoutLink() throws Exception {
        UUID intentId = UUID.randomUUID();
        when(ledger.createPendingFiat(USER, ProductType.MONTHLY, "offer-monthly")).thenReturn(intentId);

        CheckoutResponse response = service.startFiatPurchase(USER, ProductType.MONTHLY, trustedUser);

        assertEquals(intentId, response.getIntentId());
        assertEquals("Monthly Access", response.getProductName());
        String prefix = "https://checkout.test/checkout/offer-monthly?custom_data=";
        assertTrue(response.getCheckoutUrl().startsWith(prefix), response.getCheckoutUrl());

        String customData = URLDecoder.decode(response.getCheckoutUrl().substring(prefix.length()), StandardCharsets.UTF_8);
        JsonNode token = new ObjectMapper().readTree(customData);
        assertEquals(USER, token.get("userId").asText());
        assertEquals(intentId.toString(), token.get("intentId").asText());
    }

    @Test
    @DisplayName("A second purchase inside the cooldown is refused with 429")
    void startFiatPurchase_CooldownRejects() {
        when(ledger.createPendingFiat(any(), any(), any())).thenReturn(UUID.randomUUID());
        service.startFiatPurchase(USER, ProductType.MONTHLY, trustedUser);

        PurchaseRejectedException e = assertThrows(PurchaseRejectedException.class,
                () -> service.startFiatPurchase(USER, ProductType.LIFETIME, trustedUser));

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, e.getStatus());
        assertEquals("Purchase cooldown active", e.getMessage());
        verify(ledger, times(1)).createPendingFiat(any(), any(), any());
    }

    @Test
    @DisplayName("An existing active license refuses a repeat purchase with 409")
    void startFiatPurchase_DuplicateRejects() {
        when(licenseRegistry.hasActiveLicense(USER, ProductType.MONTHLY)).thenReturn(true);

        PurchaseRejectedException e = assertThrows(PurchaseRejectedException.class,
                () -> service.startFiatPurchase(USER, ProductType.MONTHLY, trustedUser));

        assertEquals(HttpStatus.CONFLICT, e.getStatus());
        verify(ledger, never()).createPendingFiat(any(), any(), any());
    }

    @Test
    @DisplayName("A brand-new account is refused and flagged for admin review")
    void startFiatPurchase_NewAccountNeedsReview() {
        UserProfile fresh = new UserProfile("bob", null, clock.instant().minus(Duration.ofDays(1)));

        PurchaseRejectedException e = assertThrows(PurchaseRejectedException.class,
                () -> service.startFiatPurchase(USER, ProductType.TWO_WEEKS, fresh));

        assertEquals(HttpStatus.FORBIDDEN, e.getStatus());
        verify(notifications).alertAdmin(eq("Account needs review"), anyString(), anyMap());
    }

    @Test
    @DisplayName("Crypto purchase quotes the USD price, records the payment and starts monitoring")
    void startCryptoPurchase_StartsMonitor() {
        BigDecimal quoted = new BigDecimal("0.00032308");
        when(priceOracle.quote(CryptoAsset.BTC, new BigDecimal("21.00"))).thenReturn(quoted);
        CryptoPayment payment = CryptoPayment.create(UUID.randomUUID(), USER, ProductType.LIFETIME, CryptoAsset.BTC,
                quoted, new BigDecimal("21.00"), TestProperties.BTC_WALLET, clock.instant(), Duration.ofMinutes(30));
        when(ledger.createPendingCrypto(USER, ProductType.LIFETIME, CryptoAsset.BTC, quoted,
                new BigDecimal("21.00"), TestProperties.BTC_WALLET)).thenReturn(payment);

        CryptoPayment started = service.startCryptoPurchase(USER, ProductType.LIFETIME, CryptoAsset.BTC, trustedUser);

        assertEquals(payment, started);
        verify(monitor).start(payment.getId());
    }

    @Test
    @DisplayName("An asset without a configured wallet is rejected before any guard runs")
    void startCryptoPurchase_NoWallet() {
        properties.getWallets().remove(CryptoAsset.LTC);

        assertThrows(IllegalArgumentException.class,
                () -> service.startCryptoPurchase(USER, ProductType.MONTHLY, CryptoAsset.LTC, trustedUser));
        verifyNoInteractions(priceOracle, monitor);
    }
}
