package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.product.ProductType;

import java.util.Optional;

/**
 * Works out which user a provider payment belongs to.
 */
public interface IdentityResolver {

    Optional<ResolvedIdentity> resolveByToken(CustomData customData);

    Optional<ResolvedIdentity> resolveByRecency(ProductType productType);

    /**
     * The token first; the recency heuristic only when there is no usable token.
     */
    default Optional<ResolvedIdentity> resolve(CustomData customData, ProductType productType) {
        Optional<ResolvedIdentity> byToken = resolveByToken(customData);
        return byToken.isPresent() ? byToken : resolveByRecency(productType);
    }
}
