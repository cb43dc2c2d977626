package com.flagship.license_fulfillment.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.fulfillment.FulfillmentOutcome;
import com.flagship.license_fulfillment.fulfillment.FulfillmentService;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.license.LicenseSource;
import com.flagship.license_fulfillment.notification.NotificationDispatcher;
import com.flagship.license_fulfillment.observability.FulfillmentMetrics;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.payment.PurchaseIntent;
import com.flagship.license_fulfillment.product.ProductCatalog;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class WebhookReconcilerTest {

    private static final String USER = "123456789012345678";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private WebhookSignatureVerifier verifier;
    private PaymentLedger ledger;
    private LicenseRegistry licenseRegistry;
    private FulfillmentService fulfillmentService;
    private NotificationDispatcher notifications;
    private WebhookReconciler reconciler;

    @BeforeEach
    void setUp() {
        FulfillmentProperties properties = TestProperties.fulfillmentProperties();
        FulfillmentMetrics metrics = new FulfillmentMetrics(new SimpleMeterRegistry());
        verifier = new WebhookSignatureVerifier(properties);
        ledger = mock(PaymentLedger.class);
        licenseRegistry = mock(LicenseRegistry.class);
        fulfillmentService = mock(FulfillmentService.class);
        notifications = mock(NotificationDispatcher.class);

        reconciler = new WebhookReconciler(
                verifier,
                new ProviderEventParser(new ObjectMapper()),
                new ProductCatalog(properties),
                new LedgerIdentityResolver(ledger, properties),
                new WebhookIdempotencyService(licenseRegistry, Optional.empty(), metrics),
                fulfillmentService,
                notifications,
                metrics);
    }

    private WebhookOutcome deliver(String json) {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        return reconciler.handle(body, "sha256_" + verifier.sign(body));
    }

    private static String success(String paymentId, String offerId, String customFields) {
        return """
            {"type": "payment_success",
             "data": {"payment": {"id": "%s", "value": 9.00},
                      "items": [{"offer": {"id": "%s"}%s}]}}
            """.formatted(paymentId, offerId, customFields == null ? "" : ", \"customFields\": " + customFields);
    }

    private static License license(String paymentId) {
        return License.issue("MONTHLY-0123456789ABCDEF", USER, ProductType.MONTHLY, paymentId, LicenseSource.FIAT, NOW);
    }

    @Test
    @DisplayName("A bad signature is rejected before the body is looked at")
    void handle_RejectsBadSignature() {
        byte[] body = success("pay_1", "offer-monthly", null).getBytes(StandardCharsets.UTF_8);

        assertThrows(InvalidSignatureException.class, () -> reconciler.handle(body, "sha256_deadbeef"));
        verifyNoInteractions(fulfillmentService);
    }

    @Test
    @DisplayName("A token with a known intent fulfills that intent for its owner")
    void handle_FulfillsByToken() {
        PurchaseIntent intent = PurchaseIntent.create(UUID.randomUUID(), USER, ProductType.MONTHLY, "offer-monthly", NOW);
        when(ledger.findIntent(intent.getId())).thenReturn(Optional.of(intent));
        when(fulfillmentService.fulfillFiat(USER, intent.getId(), ProductType.MONTHLY, "pay_1"))
                .thenReturn(FulfillmentOutcome.fulfilled(license("pay_1")));

        WebhookOutcome outcome = deliver(success("pay_1", "offer-monthly",
                "{\"userId\": \"" + USER + "\", \"intentId\": \"" + intent.getId() + "\"}"));

        assertEquals(WebhookOutcome.FULFILLED, outcome);
        verify(ledger, never()).findCorrelatedIntent(any(), any());
    }

    @Test
    @DisplayName("Without a token the recent pending intent for the product is used")
    void handle_FulfillsByRecency() {
        PurchaseIntent intent = PurchaseIntent.create(UUID.randomUUID(), USER, ProductType.MONTHLY, "offer-monthly", NOW);
        when(ledger.findCorrelatedIntent(ProductType.MONTHLY, Duration.ofMinutes(5))).thenReturn(Optional.of(intent));
        when(fulfillmentService.fulfillFiat(USER, intent.getId(), ProductType.MONTHLY, "pay_2"))
                .thenReturn(FulfillmentOutcome.fulfilled(license("pay_2")));

        assertEquals(WebhookOutcome.FULFILLED, deliver(success("pay_2", "offer-monthly", null)));
    }

    @Test
    @DisplayName("Repeated deliveries of a fulfilled payment are acknowledged without a second license")
    void handle_ReplaysAreDuplicates() {
        PurchaseIntent intent = PurchaseIntent.create(UUID.randomUUID(), USER, ProductType.MONTHLY, "offer-monthly", NOW);
        when(ledger.findIntent(intent.getId())).thenReturn(Optional.of(intent));
        when(licenseRegistry.isIssuedFor("pay_3")).thenReturn(false, true);
        when(fulfillmentService.fulfillFiat(anyString(), any(), any(), eq("pay_3")))
                .thenReturn(FulfillmentOutcome.fulfilled(license("pay_3")));
        String body = success("pay_3", "offer-monthly", "{\"intentId\": \"" + intent.getId() + "\"}");

        assertEquals(WebhookOutcome.FULFILLED, deliver(body));
        for (int i = 0; i < 4; i++) {
            assertEquals(WebhookOutcome.DUPLICATE, deliver(body));
        }
        verify(fulfillmentService, times(1)).fulfillFiat(anyString(), any(), any(), eq("pay_3"));
    }

    @Test
    @DisplayName("A concurrent delivery that loses the unique-constraint race is a duplicate")
    void handle_ConstraintViolationIsDuplicate() {
        when(fulfillmentService.fulfillFiat(eq(USER), isNull(), eq(ProductType.MONTHLY), eq("pay_4")))
                .thenThrow(new DataIntegrityViolationException("uk_licenses_source_payment"));

        assertEquals(WebhookOutcome.DUPLICATE,
                deliver(success("pay_4", "offer-monthly", "{\"userId\": \"" + USER + "\"}")));
    }

    @Test
    @DisplayName("A payment for an unmapped product is acknowledged and not fulfilled")
    void handle_UnknownProduct() {
        assertEquals(WebhookOutcome.UNKNOWN_PRODUCT, deliver(success("pay_5", "offer-nobody-knows", null)));
        verifyNoInteractions(fulfillmentService);
    }

    @Test
    @DisplayName("A payment that cannot be tied to a user alerts an admin")
    void handle_UnresolvedAlertsAdmin() {
        when(ledger.findCorrelatedIntent(any(), any())).thenReturn(Optional.empty());

        assertEquals(WebhookOutcome.UNRESOLVED, deliver(success("pay_6", "offer-lifetime", null)));
        verify(notifications).alertAdmin(eq("Unresolvable payment"), anyString(), anyMap());
        verifyNoInteractions(fulfillmentService);
    }

    @Test
    @DisplayName("A failure event fails the referenced intent")
    void handle_PaymentFailed() {
        PurchaseIntent intent = PurchaseIntent.create(UUID.randomUUID(), USER, ProductType.MONTHLY, "offer-monthly", NOW);
        when(ledger.findIntent(intent.getId())).thenReturn(Optional.of(intent));

        WebhookOutcome outcome = deliver("""
            {"type": "payment_failed",
             "data": {"payment": {"id": "pay_7", "customFields": {"intentId": "%s"}},
                      "reason": "card_declined"}}
            """.formatted(intent.getId()));

        assertEquals(WebhookOutcome.PAYMENT_FAILED, outcome);
        verify(fulfillmentService).failIntent(intent.getId(), null, "card_declined");
    }

    @Test
    @DisplayName("A flat failure event without a token notifies the customer id")
    void handle_FlatPaymentFailed() {
        WebhookOutcome outcome = deliver("""
            {"type": "payment_failed",
             "data": {"payment_id": "pay_8", "customer_id": "%s"}}
            """.formatted(USER));

        assertEquals(WebhookOutcome.PAYMENT_FAILED, outcome);
        verify(fulfillmentService).failIntent(null, USER, null);
    }

    @Test
    @DisplayName("A refund event revokes the license for the payment")
    void handle_Refund() {
        assertEquals(WebhookOutcome.REFUNDED,
                deliver("{\"type\": \"payment_refunded\", \"data\": {\"payment_id\": \"pay_9\"}}"));
        verify(fulfillmentService).refund("pay_9");
    }

    @Test
    @DisplayName("Unknown event types are acknowledged and ignored")
    void handle_UnknownEventIgnored() {
        assertEquals(WebhookOutcome.IGNORED, deliver("{\"type\": \"customer_updated\", \"data\": {}}"));
        verifyNoInteractions(fulfillmentService);
    }
}
