package com.flagship.license_fulfillment.purchase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.payment.CryptoPaymentStatus;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment instructions for a crypto purchase, also used for status lookups.
 * The crypto amount is rendered as a plain string so no precision is lost.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CryptoPaymentResponse {

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("product_type")
    ProductType productType;

    @JsonProperty("asset")
    CryptoAsset asset;

    @JsonProperty("crypto_amount")
    String cryptoAmount;

    @JsonProperty("usd_amount")
    BigDecimal usdAmount;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("status")
    CryptoPaymentStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("txid")
    String txid;

    @JsonProperty("transaction_link")
    String transactionLink;

    public static CryptoPaymentResponse from(CryptoPayment payment) {
        return CryptoPaymentResponse.builder()
                .paymentId(payment.getId())
                .productType(payment.getProductType())
                .asset(payment.getAsset())
                .cryptoAmount(payment.getCryptoAmount().toPlainString())
                .usdAmount(payment.getUsdAmount())
                .walletAddress(payment.getWalletAddress())
                .status(payment.getStatus())
                .createdAt(payment.getCreatedAt())
                .expiresAt(payment.getExpiresAt())
                .txid(payment.getTxid())
                .transactionLink(payment.getTxid() == null ? null : payment.getAsset().explorerLink(payment.getTxid()))
                .build();
    }
}
