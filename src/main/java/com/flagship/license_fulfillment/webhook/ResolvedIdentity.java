package com.flagship.license_fulfillment.webhook;

import java.util.UUID;

/**
 * Who paid, and how sure we are about it.
 *
 * @param intentId the matching purchase intent, null when only the user is known
 */
public record ResolvedIdentity(String userId, UUID intentId, Confidence confidence) {

    public enum Confidence {
        /** Identified by the token we embedded in the checkout link. */
        TOKEN,
        /** Guessed from the most recent pending intent for the product. */
        RECENCY
    }
}
