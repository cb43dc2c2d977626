package com.flagship.license_fulfillment.product;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Products a user can buy.
 *
 * The code is the external identifier used in license key prefixes and API
 * payloads ("2weeks", "monthly", "lifetime"). Lifetime licenses run for 100
 * years and are exempt from the one-active-license rule.
 */
public enum ProductType {

    TWO_WEEKS("2weeks", "2 Weeks Access", Duration.ofDays(14), new BigDecimal("5.00")),

    MONTHLY("monthly", "Monthly Access", Duration.ofDays(30), new BigDecimal("9.00")),

    LIFETIME("lifetime", "Lifetime Access", Duration.ofDays(100L * 365), new BigDecimal("21.00"));

    private final String code;
    private final String displayName;
    private final Duration licenseDuration;
    private final BigDecimal cryptoUsdPrice;

    ProductType(String code, String displayName, Duration licenseDuration, BigDecimal cryptoUsdPrice) {
        this.code = code;
        this.displayName = displayName;
        this.licenseDuration = licenseDuration;
        this.cryptoUsdPrice = cryptoUsdPrice;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Duration getLicenseDuration() {
        return licenseDuration;
    }

    public BigDecimal getCryptoUsdPrice() {
        return cryptoUsdPrice;
    }

    public boolean isLifetime() {
        return this == LIFETIME;
    }

    /** Upper-cased code, used as the license key prefix. */
    public String keyPrefix() {
        return code.toUpperCase();
    }

    public static Optional<ProductType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ProductType of(String code) {
        return fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown product type: " + code));
    }
}
