package com.flagship.license_fulfillment.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.guard.UserProfile;
import com.flagship.license_fulfillment.product.ProductType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class FiatPurchaseRequest {

    @NotBlank(message = "User ID is required")
    @Pattern(regexp = "\\d{17,19}", message = "User ID must be 17 to 19 digits")
    @JsonProperty("user_id")
    String userId;

    @NotNull(message = "Product type is required")
    @JsonProperty("product_type")
    ProductType productType;

    @Valid
    @NotNull(message = "User profile is required")
    @JsonProperty("user")
    UserProfile user;
}
