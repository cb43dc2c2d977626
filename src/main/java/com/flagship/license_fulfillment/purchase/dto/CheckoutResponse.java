package com.flagship.license_fulfillment.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Hosted checkout link for a recorded purchase intent.
 */
@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("intent_id")
    UUID intentId;

    @JsonProperty("product_type")
    ProductType productType;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("checkout_url")
    String checkoutUrl;
}
