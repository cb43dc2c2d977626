package com.flagship.license_fulfillment.license;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an import batch contains keys that already exist.
 */
@Getter
public class DuplicateLicenseKeyException extends IllegalArgumentException {

    private final List<String> duplicateKeys;

    public DuplicateLicenseKeyException(List<String> duplicateKeys) {
        super("The following keys already exist: " + String.join(", ", duplicateKeys));
        this.duplicateKeys = List.copyOf(duplicateKeys);
    }
}
