package com.flagship.license_fulfillment.license.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.license_fulfillment.product.ProductType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ImportKeysRequest {

    @NotEmpty(message = "At least one key is required")
    @JsonProperty("keys")
    List<String> keys;

    @NotNull(message = "Product type is required")
    @JsonProperty("product_type")
    ProductType productType;

    /** Optional owner; unassigned keys are imported without one. */
    @JsonProperty("user_id")
    String userId;

    @NotBlank(message = "Importing admin is required")
    @JsonProperty("added_by")
    String addedBy;
}
