package com.flagship.license_fulfillment.crypto;

/**
 * A block explorer or price API could not be reached or returned something
 * unusable. Treated as transient by callers.
 */
public class ChainDataException extends RuntimeException {

    public ChainDataException(String message) {
        super(message);
    }

    public ChainDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
