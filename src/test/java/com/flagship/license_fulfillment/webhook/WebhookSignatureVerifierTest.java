package com.flagship.license_fulfillment.webhook;

import com.flagship.license_fulfillment.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(TestProperties.fulfillmentProperties());
    private final byte[] body = "{\"type\":\"payment_success\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Prefixed and bare lower- or upper-case signatures are accepted")
    void verifyOrThrow_AcceptsValidSignature() {
        String hex = verifier.sign(body);

        assertDoesNotThrow(() -> verifier.verifyOrThrow(body, "sha256_" + hex));
        assertDoesNotThrow(() -> verifier.verifyOrThrow(body, hex));
        assertDoesNotThrow(() -> verifier.verifyOrThrow(body, "sha256_" + hex.toUpperCase()));
    }

    @Test
    @DisplayName("A signature over a different body is rejected")
    void verifyOrThrow_RejectsTamperedBody() {
        String signature = "sha256_" + verifier.sign(body);
        byte[] tampered = "{\"type\":\"payment_refunded\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(InvalidSignatureException.class, () -> verifier.verifyOrThrow(tampered, signature));
    }

    @Test
    @DisplayName("Missing signature header is rejected")
    void verifyOrThrow_RejectsMissingHeader() {
        assertThrows(InvalidSignatureException.class, () -> verifier.verifyOrThrow(body, null));
        assertThrows(InvalidSignatureException.class, () -> verifier.verifyOrThrow(body, "  "));
    }

    @Test
    @DisplayName("Signature is the lower-case hex HMAC-SHA256 of the raw body")
    void sign_IsLowerCaseHex() {
        String hex = verifier.sign(body);

        assertEquals(64, hex.length());
        assertTrue(hex.matches("[0-9a-f]+"));
    }
}
