package com.flagship.license_fulfillment.license;

import java.util.Optional;

/**
 * Outcome of looking up a license key for validation.
 */
public record LicenseValidation(Status status, License license) {

    public enum Status {
        VALID,
        EXPIRED,
        NOT_FOUND
    }

    public static LicenseValidation valid(License license) {
        return new LicenseValidation(Status.VALID, license);
    }

    public static LicenseValidation expired(License license) {
        return new LicenseValidation(Status.EXPIRED, license);
    }

    public static LicenseValidation notFound() {
        return new LicenseValidation(Status.NOT_FOUND, null);
    }

    public Optional<License> findLicense() {
        return Optional.ofNullable(license);
    }
}
