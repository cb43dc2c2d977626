package com.flagship.license_fulfillment.license.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.license.DeactivationReason;
import com.flagship.license_fulfillment.license.License;
import com.flagship.license_fulfillment.license.LicenseSource;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LicenseResponse {

    @JsonProperty("license_key")
    String licenseKey;

    @JsonProperty("product_type")
    ProductType productType;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("source")
    LicenseSource source;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expiration_date")
    Instant expirationDate;

    @JsonProperty("deactivated_at")
    Instant deactivatedAt;

    @JsonProperty("deactivation_reason")
    DeactivationReason deactivationReason;

    public static LicenseResponse from(License license) {
        return LicenseResponse.builder()
                .licenseKey(license.getLicenseKey())
                .productType(license.getProductType())
                .active(license.isActive())
                .source(license.getSource())
                .createdAt(license.getCreatedAt())
                .expirationDate(license.getExpirationDate())
                .deactivatedAt(license.getDeactivatedAt())
                .deactivationReason(license.getDeactivationReason())
                .build();
    }
}
