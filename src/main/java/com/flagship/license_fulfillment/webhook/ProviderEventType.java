package com.flagship.license_fulfillment.webhook;

import java.util.Arrays;

public enum ProviderEventType {

    PAYMENT_SUCCESS("payment_success"),
    PAYMENT_FAILED("payment_failed"),
    PAYMENT_REFUNDED("payment_refunded"),
    UNKNOWN("unknown");

    private final String wireName;

    ProviderEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ProviderEventType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
