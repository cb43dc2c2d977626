package com.flagship.license_fulfillment.license;

/**
 * How a license came into existence.
 */
public enum LicenseSource {
    /** Provider webhook for a card/checkout payment. */
    FIAT,
    /** On-chain payment detected by the crypto monitor. */
    CRYPTO,
    /** Imported by an administrator in a batch. */
    MANUAL
}
