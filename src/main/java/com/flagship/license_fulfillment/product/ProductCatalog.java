package com.flagship.license_fulfillment.product;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Static mapping between internal product types and the payment provider's
 * offer ids.
 */
@Component
@Slf4j
public class ProductCatalog {

    private final Map<ProductType, String> providerProductIds;

    public ProductCatalog(FulfillmentProperties properties) {
        this.providerProductIds = Map.copyOf(properties.getProviderProductIds());
        for (ProductType type : ProductType.values()) {
            if (!providerProductIds.containsKey(type)) {
                log.warn("No provider product id configured for {}; webhooks for it cannot be mapped", type.getCode());
            }
        }
    }

    public Optional<ProductType> findByProviderProductId(String providerProductId) {
        if (providerProductId == null || providerProductId.isBlank()) {
            return Optional.empty();
        }
        return providerProductIds.entrySet().stream()
                .filter(entry -> entry.getValue().equals(providerProductId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public String providerProductId(ProductType productType) {
        String id = providerProductIds.get(productType);
        if (id == null) {
            throw new IllegalStateException("No provider product id configured for " + productType.getCode());
        }
        return id;
    }
}
