package com.flagship.license_fulfillment.config;

import com.flagship.license_fulfillment.crypto.CryptoAsset;
import com.flagship.license_fulfillment.product.ProductType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for payment fulfillment and license issuance.
 *
 * Secrets are expected to come from the environment
 * (FULFILLMENT_LICENSE_SECRET, FULFILLMENT_WEBHOOK_SECRET).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fulfillment")
public class FulfillmentProperties {

    /** HMAC secret used to derive license keys. */
    @NotBlank
    private String licenseSecret;

    /** Shared secret the payment provider signs webhook bodies with. */
    @NotBlank
    private String webhookSecret;

    /** Hosted checkout base URL; the provider product id is appended. */
    @NotBlank
    private String checkoutBaseUrl = "https://checkout.example.com/checkout";

    /** Provider offer id for each product type. */
    @NotNull
    private Map<ProductType, String> providerProductIds = new EnumMap<>(ProductType.class);

    /** Static receiving wallet per crypto asset. */
    @NotNull
    private Map<CryptoAsset, String> wallets = new EnumMap<>(CryptoAsset.class);

    /** Chat user ids allowed to import license keys. Empty means nobody. */
    @NotNull
    private Set<String> adminUserIds = new LinkedHashSet<>();

    @Valid
    private Chain chain = new Chain();

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Guard guard = new Guard();

    /** Window for the recency-based correlation fallback. */
    @NotNull
    private Duration correlationWindow = Duration.ofMinutes(5);

    @Getter
    @Setter
    @Validated
    public static class Chain {
        @NotBlank
        private String blockstreamBaseUrl = "https://blockstream.info/api";
        @NotBlank
        private String blockchairBaseUrl = "https://api.blockchair.com/litecoin";
        @NotBlank
        private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";
        /** How many recent transactions to inspect on explorers that page results. */
        @Min(1)
        private int transactionLimit = 10;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    @Validated
    public static class Monitor {
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(30);
        @Min(1)
        private int maxPolls = 60;
        @NotNull
        private Duration paymentWindow = Duration.ofMinutes(30);
        @NotNull
        @DecimalMin("0")
        private BigDecimal amountTolerance = new BigDecimal("0.00001");
        /** Re-arm monitors for pending payments when the application starts. */
        private boolean resumeOnStartup = true;
        /** Threads in the pool dedicated to payment monitors. */
        @Min(1)
        private int schedulerPoolSize = 8;
    }

    @Getter
    @Setter
    @Validated
    public static class Guard {
        @Min(1)
        private int purchaseRateLimit = 3;
        @NotNull
        private Duration rateLimitWindow = Duration.ofMinutes(1);
        @NotNull
        private Duration purchaseCooldown = Duration.ofMinutes(5);
        @NotNull
        private Duration duplicateWindow = Duration.ofMinutes(10);
        @NotNull
        private Duration minimumAccountAge = Duration.ofDays(7);
        @Min(1)
        private int suspiciousActivityThreshold = 20;
        @NotNull
        private Duration suspiciousActivityWindow = Duration.ofHours(24);
    }
}
