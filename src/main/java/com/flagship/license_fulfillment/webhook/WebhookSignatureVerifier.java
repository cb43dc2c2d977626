package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the provider's {@code sha256_<hex>} HMAC over the raw request body.
 */
@Component
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "X-Provider-Signature";
    static final String SIGNATURE_PREFIX = "sha256_";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec secretKey;

    public WebhookSignatureVerifier(FulfillmentProperties properties) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Webhook secret is not configured");
        }
        this.secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    /**
     * @throws InvalidSignatureException if the header is missing or does not match
     */
    public void verifyOrThrow(byte[] rawBody, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing " + SIGNATURE_HEADER + " header");
        }
        String received = signatureHeader.trim();
        if (received.startsWith(SIGNATURE_PREFIX)) {
            received = received.substring(SIGNATURE_PREFIX.length());
        }

        byte[] expected = sign(rawBody).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, received.toLowerCase().getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidSignatureException("Invalid webhook signature");
        }
    }

    /**
     * Lower-case hex HMAC-SHA256 of the body, without the prefix.
     */
    public String sign(byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(secretKey);
            return HexFormat.of().formatHex(mac.doFinal(rawBody == null ? new byte[0] : rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }
}
