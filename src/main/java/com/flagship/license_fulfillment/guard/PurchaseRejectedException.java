package com.flagship.license_fulfillment.guard;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A purchase refused by one of the abuse guards.
 *
 * The exception message is the internal reason; {@link #getUserMessage()} is
 * what the user gets to see.
 */
@Getter
public class PurchaseRejectedException extends RuntimeException {

    private final String userMessage;
    private final HttpStatus status;

    public PurchaseRejectedException(String reason, String userMessage, HttpStatus status) {
        super(reason);
        this.userMessage = userMessage;
        this.status = status;
    }

    public static PurchaseRejectedException rateLimited() {
        return new PurchaseRejectedException("Rate limit exceeded",
                "You're making requests too quickly. Please wait a minute and try again.",
                HttpStatus.TOO_MANY_REQUESTS);
    }

    public static PurchaseRejectedException coolingDown() {
        return new PurchaseRejectedException("Purchase cooldown active",
                "Please wait a few minutes before starting another purchase.",
                HttpStatus.TOO_MANY_REQUESTS);
    }

    public static PurchaseRejectedException duplicate(String reason) {
        String message = DuplicateCheck.ACTIVE_LICENSE_EXISTS.equals(reason)
                ? "You already have an active license for this product."
                : "You already have a pending payment for this product. Please complete it or wait for it to expire.";
        return new PurchaseRejectedException(reason, message, HttpStatus.CONFLICT);
    }

    public static PurchaseRejectedException accountRejected(String reason) {
        return new PurchaseRejectedException(reason,
                "Your account requires manual review before purchasing. Please contact support.",
                HttpStatus.FORBIDDEN);
    }
}
