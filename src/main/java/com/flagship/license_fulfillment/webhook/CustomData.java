package com.flagship.license_fulfillment.webhook;

/**
 * The correlation token we attach to checkout links and the provider echoes
 * back. Either field may be missing.
 */
public record CustomData(String userId, String intentId) {

    public static CustomData empty() {
        return new CustomData(null, null);
    }

    public boolean isEmpty() {
        return isBlank(userId) && isBlank(intentId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
