package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.product.ProductType;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Generates license key strings of the form {@code MONTHLY-3F09A1C2D4E5B6F7}.
 *
 * The suffix is the first 64 bits of an HMAC-SHA256 over
 * {@code userId-productType-epochMillis-random}, keyed with the deployment
 * license secret. Global uniqueness is enforced by the registry, not by the
 * digest alone.
 */
@Component
public class LicenseKeyCodec {

    static final int DIGEST_HEX_LENGTH = 16;
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_LENGTH = 13;

    private final SecretKeySpec secretKey;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public LicenseKeyCodec(FulfillmentProperties properties, Clock clock) {
        String secret = properties.getLicenseSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("License secret is not configured");
        }
        this.secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.clock = clock;
    }

    public String generate(String userId, ProductType productType) {
        String entropy = String.join("-",
                String.valueOf(userId),
                productType.getCode(),
                String.valueOf(clock.millis()),
                randomToken());
        String digest = hmacHex(entropy).substring(0, DIGEST_HEX_LENGTH);
        return productType.keyPrefix() + "-" + digest.toUpperCase();
    }

    /**
     * Checks only that the key carries the product's prefix.
     *
     * The digest is not re-derived (the entropy input is not stored), so a
     * forged key with the right prefix passes. Authority lies with the
     * registry lookup.
     */
    public boolean verifyFormat(String licenseKey, ProductType productType) {
        if (licenseKey == null || productType == null) {
            return false;
        }
        int separator = licenseKey.indexOf('-');
        String prefix = separator < 0 ? licenseKey : licenseKey.substring(0, separator);
        return prefix.equals(productType.keyPrefix());
    }

    private String randomToken() {
        char[] token = new char[RANDOM_LENGTH];
        for (int i = 0; i < token.length; i++) {
            token[i] = BASE36[random.nextInt(BASE36.length)];
        }
        return new String(token);
    }

    private String hmacHex(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(secretKey);
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute license key digest", e);
        }
    }
}
