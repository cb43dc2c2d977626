package com.flagship.license_fulfillment.license.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public answer to "is this key good?". Field names follow what existing
 * redemption clients already parse.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("message")
    String message;

    @JsonProperty("productType")
    ProductType productType;

    @JsonProperty("expirationDate")
    Instant expirationDate;

    @JsonProperty("createdAt")
    Instant createdAt;

    public static ValidationResponse valid(License license) {
        return ValidationResponse.builder()
                .valid(true)
                .productType(license.getProductType())
                .expirationDate(license.getExpirationDate())
                .createdAt(license.getCreatedAt())
                .build();
    }

    public static ValidationResponse expired(License license) {
        return ValidationResponse.builder()
                .valid(false)
                .message("License expired")
                .expirationDate(license.getExpirationDate())
                .build();
    }

    public static ValidationResponse notFound() {
        return ValidationResponse.builder()
                .valid(false)
                .message("License not found")
                .build();
    }
}
