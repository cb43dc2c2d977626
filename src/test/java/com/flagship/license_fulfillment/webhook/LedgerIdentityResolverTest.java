package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.payment.PurchaseIntent;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LedgerIdentityResolverTest {

    private static final String OWNER = "123456789012345678";

    private PaymentLedger ledger;
    private LedgerIdentityResolver resolver;
    private PurchaseIntent intent;

    @BeforeEach
    void setUp() {
        ledger = mock(PaymentLedger.class);
        resolver = new LedgerIdentityResolver(ledger, TestProperties.fulfillmentProperties());
        intent = PurchaseIntent.create(UUID.randomUUID(), OWNER, ProductType.MONTHLY, "offer-monthly",
                Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("A known intent id resolves to the intent owner with token confidence")
    void resolve_KnownIntent() {
        when(ledger.findIntent(intent.getId())).thenReturn(Optional.of(intent));

        ResolvedIdentity identity = resolver.resolve(
                new CustomData(OWNER, intent.getId().toString()), ProductType.MONTHLY).orElseThrow();

        assertEquals(OWNER, identity.userId());
        assertEquals(intent.getId(), identity.intentId());
        assertEquals(ResolvedIdentity.Confidence.TOKEN, identity.confidence());
        verify(ledger, never()).findCorrelatedIntent(any(), any());
    }

    @Test
    @DisplayName("The intent owner wins over a conflicting user id in the token")
    void resolve_OwnerWinsOverTokenUser() {
        when(ledger.findIntent(intent.getId())).thenReturn(Optional.of(intent));

        ResolvedIdentity identity = resolver.resolveByToken(
                new CustomData("999999999999999999", intent.getId().toString())).orElseThrow();

        assertEquals(OWNER, identity.userId());
    }

    @Test
    @DisplayName("An unknown intent with a user id still resolves to that user, without an intent")
    void resolve_UnknownIntentWithUser() {
        ResolvedIdentity identity = resolver.resolveByToken(
                new CustomData(OWNER, UUID.randomUUID().toString())).orElseThrow();

        assertEquals(OWNER, identity.userId());
        assertNull(identity.intentId());
    }

    @Test
    @DisplayName("Without a token the most recent pending intent for the product is used")
    void resolve_FallsBackToRecency() {
        when(ledger.findCorrelatedIntent(ProductType.MONTHLY, Duration.ofMinutes(5))).thenReturn(Optional.of(intent));

        ResolvedIdentity identity = resolver.resolve(CustomData.empty(), ProductType.MONTHLY).orElseThrow();

        assertEquals(OWNER, identity.userId());
        assertEquals(intent.getId(), identity.intentId());
        assertEquals(ResolvedIdentity.Confidence.RECENCY, identity.confidence());
    }

    @Test
    @DisplayName("A token with a malformed intent id and no user falls through to recency")
    void resolve_MalformedTokenFallsThrough() {
        when(ledger.findCorrelatedIntent(any(), any())).thenReturn(Optional.empty());

        assertTrue(resolver.resolve(new CustomData(null, "not-a-uuid"), ProductType.LIFETIME).isEmpty());
        verify(ledger).findCorrelatedIntent(ProductType.LIFETIME, Duration.ofMinutes(5));
    }
}
