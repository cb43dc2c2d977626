package com.flagship.license_fulfillment.guard;

public record UserValidation(boolean valid, String reason, boolean requiresManualReview) {

    public static UserValidation accepted() {
        return new UserValidation(true, null, false);
    }

    public static UserValidation rejected(String reason) {
        return new UserValidation(false, reason, true);
    }
}
