package com.flagship.license_fulfillment.license;

/**
 * Raised when a non-admin user attempts an admin-only operation.
 */
public class AdminAccessDeniedException extends RuntimeException {

    public AdminAccessDeniedException(String userId) {
        super("User " + userId + " is not an admin");
    }
}
