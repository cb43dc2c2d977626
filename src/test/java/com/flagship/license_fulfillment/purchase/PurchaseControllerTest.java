package com.flagship.license_fulfillment.purchase;

import com.flagship.license_fulfillment.crypto.ChainDataException;
import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.guard.PurchaseRejectedException;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.purchase.dto.CheckoutResponse;
import com.flagship.license_fulfillment.support.FixedClockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PurchaseController.class)
@Import(FixedClockConfig.class)
@ActiveProfiles("test")
class PurchaseControllerTest {

    private static final String USER = "123456789012345678";
    private static final String FIAT_BODY = """
        {"user_id": "123456789012345678", "product_type": "monthly",
         "user": {"username": "alice", "avatar": "a1b2", "account_created_at": "2023-01-01T00:00:00Z"}}
        """;
    private static final String CRYPTO_BODY = """
        {"user_id": "123456789012345678", "product_type": "lifetime", "asset": "btc",
         "user": {"username": "alice", "avatar": "a1b2", "account_created_at": "2023-01-01T00:00:00Z"}}
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PurchaseService purchaseService;

    @Test
    @DisplayName("Fiat purchase returns 201 with the checkout link")
    void startFiat_Created() throws Exception {
        UUID intentId = UUID.randomUUID();
        when(purchaseService.startFiatPurchase(eq(USER), eq(ProductType.MONTHLY), any()))
                .thenReturn(CheckoutResponse.builder()
                    .intentId(intentId)
                    .productType(ProductType.MONTHLY)
                    .productName("Monthly Access")
                    .checkoutUrl("https://checkout.test/checkout/offer-monthly?custom_data=x")
                    .build());

        mockMvc.perform(post("/api/purchases/fiat").contentType(MediaType.APPLICATION_JSON).content(FIAT_BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.intent_id").value(intentId.toString()))
            .andExpect(jsonPath("$.product_type").value("monthly"))
            .andExpect(jsonPath("$.checkout_url").value("https://checkout.test/checkout/offer-monthly?custom_data=x"));
    }

    @Test
    @DisplayName("A guard rejection surfaces its status and user-facing message")
    void startFiat_Rejected() throws Exception {
        when(purchaseService.startFiatPurchase(any(), any(), any())).thenThrow(PurchaseRejectedException.rateLimited());

        mockMvc.perform(post("/api/purchases/fiat").contentType(MediaType.APPLICATION_JSON).content(FIAT_BODY))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.message").value("You're making requests too quickly. Please wait a minute and try again."));
    }

    @Test
    @DisplayName("An unknown product type is a 400")
    void startFiat_UnknownProduct() throws Exception {
        mockMvc.perform(post("/api/purchases/fiat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(FIAT_BODY.replace("monthly", "weekly")))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(purchaseService);
    }

    @Test
    @DisplayName("A user id longer than the ledger column is rejected before any work")
    void startFiat_OverlongUserId() throws Exception {
        String overlong = "1".repeat(40);
        mockMvc.perform(post("/api/purchases/fiat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(FIAT_BODY.replace(USER, overlong)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.userId").value("User ID must be 17 to 19 digits"));
        verifyNoInteractions(purchaseService);
    }

    @Test
    @DisplayName("A non-numeric user id on a crypto purchase fails validation")
    void startCrypto_NonNumericUserId() throws Exception {
        mockMvc.perform(post("/api/purchases/crypto")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CRYPTO_BODY.replace(USER, "alice#1234")))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(purchaseService);
    }

    @Test
    @DisplayName("A request without the user profile fails validation")
    void startFiat_MissingProfile() throws Exception {
        mockMvc.perform(post("/api/purchases/fiat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\": \"123456789012345678\", \"product_type\": \"monthly\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Crypto purchase returns the exact amount as a string and the wallet")
    void startCrypto_Created() throws Exception {
        CryptoPayment payment = CryptoPayment.create(UUID.randomUUID(), USER, ProductType.LIFETIME, CryptoAsset.BTC,
                new BigDecimal("0.00032308"), new BigDecimal("21.00"), "bc1qtestwalletaddress",
                FixedClockConfig.NOW, Duration.ofMinutes(30));
        when(purchaseService.startCryptoPurchase(eq(USER), eq(ProductType.LIFETIME), eq(CryptoAsset.BTC), any()))
                .thenReturn(payment);

        mockMvc.perform(post("/api/purchases/crypto").contentType(MediaType.APPLICATION_JSON).content(CRYPTO_BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.payment_id").value(payment.getId().toString()))
            .andExpect(jsonPath("$.crypto_amount").value("0.00032308"))
            .andExpect(jsonPath("$.wallet_address").value("bc1qtestwalletaddress"))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.transaction_link").doesNotExist());
    }

    @Test
    @DisplayName("An unavailable price feed is a 503")
    void startCrypto_PriceUnavailable() throws Exception {
        when(purchaseService.startCryptoPurchase(any(), any(), any(), any()))
                .thenThrow(new ChainDataException("Failed to get BTC exchange rate"));

        mockMvc.perform(post("/api/purchases/crypto").contentType(MediaType.APPLICATION_JSON).content(CRYPTO_BODY))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Latest crypto payment is 404 when the user has none")
    void latestCrypto_NotFound() throws Exception {
        when(purchaseService.latestCryptoPayment(USER)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/purchases/crypto/latest").param("userId", USER))
            .andExpect(status().isNotFound());
    }
}
