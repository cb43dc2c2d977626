package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gates admin operations on the configured admin user ids.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAuthorizer {

    private final FulfillmentProperties properties;

    public void requireAdmin(String userId) {
        if (userId == null || !properties.getAdminUserIds().contains(userId)) {
            log.warn("Refusing admin operation for user {}", userId);
            throw new AdminAccessDeniedException(userId);
        }
    }
}
