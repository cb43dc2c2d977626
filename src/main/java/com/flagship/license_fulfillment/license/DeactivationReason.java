package com.flagship.license_fulfillment.license;

public enum DeactivationReason {
    EXPIRED,
    REFUNDED
}
