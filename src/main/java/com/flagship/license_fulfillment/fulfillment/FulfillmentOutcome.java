package com.flagship.license_fulfillment.fulfillment;

import com.flagship.license_fulfillment.license.License;

import java.util.Optional;

/**
 * Result of a fulfillment attempt. A duplicate is a replay of a payment that
 * was already turned into a license (or an intent that is no longer pending)
 * and carries no license.
 */
public record FulfillmentOutcome(Status status, License license) {

    public enum Status {
        FULFILLED,
        DUPLICATE
    }

    public static FulfillmentOutcome fulfilled(License license) {
        return new FulfillmentOutcome(Status.FULFILLED, license);
    }

    public static FulfillmentOutcome duplicate() {
        return new FulfillmentOutcome(Status.DUPLICATE, null);
    }

    public boolean isFulfilled() {
        return status == Status.FULFILLED;
    }

    public Optional<License> findLicense() {
        return Optional.ofNullable(license);
    }
}
