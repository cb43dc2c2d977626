package com.flagship.license_fulfillment.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * What the chat layer tells us about the account making a purchase.
 *
 * @param avatar avatar hash or URL, null when the account uses the default avatar
 */
public record UserProfile(
    @NotBlank @JsonProperty("username") String username,
    @JsonProperty("avatar") String avatar,
    @NotNull @JsonProperty("account_created_at") Instant accountCreatedAt
) {

    public boolean hasDefaultAvatar() {
        return avatar == null || avatar.isBlank();
    }
}
