package com.flagship.license_fulfillment.guard;

public record DuplicateCheck(boolean duplicate, String reason) {

    public static final String RECENT_PENDING_PAYMENT = "Recent pending payment exists";
    public static final String ACTIVE_LICENSE_EXISTS = "Active license already exists";

    public static DuplicateCheck clear() {
        return new DuplicateCheck(false, null);
    }

    public static DuplicateCheck duplicate(String reason) {
        return new DuplicateCheck(true, reason);
    }
}
