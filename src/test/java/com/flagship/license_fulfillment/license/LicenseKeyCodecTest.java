package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.product.ProductType;
import com.flagship.license_fulfillment.support.MutableClock;
import com.flagship.license_fulfillment.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LicenseKeyCodecTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final LicenseKeyCodec codec = new LicenseKeyCodec(TestProperties.fulfillmentProperties(), clock);

    @Test
    @DisplayName("Generated key is the upper-cased product code followed by 16 upper-case hex digits")
    void generate_ProducesPrefixedHexKey() {
        String key = codec.generate("123456789012345678", ProductType.MONTHLY);

        assertTrue(key.matches("MONTHLY-[0-9A-F]{16}"), "Unexpected key shape: " + key);
        assertTrue(codec.generate("123456789012345678", ProductType.TWO_WEEKS).startsWith("2WEEKS-"));
        assertTrue(codec.generate("123456789012345678", ProductType.LIFETIME).startsWith("LIFETIME-"));
    }

    @Test
    @DisplayName("Same user, product and instant still yield different keys")
    void generate_IsRandomizedWithinSameMillisecond() {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            keys.add(codec.generate("123456789012345678", ProductType.MONTHLY));
        }
        assertEquals(50, keys.size());
    }

    @Test
    @DisplayName("Format check accepts only the matching product prefix")
    void verifyFormat_ChecksPrefix() {
        String key = codec.generate("123456789012345678", ProductType.TWO_WEEKS);

        assertTrue(codec.verifyFormat(key, ProductType.TWO_WEEKS));
        assertFalse(codec.verifyFormat(key, ProductType.MONTHLY));
        assertFalse(codec.verifyFormat(null, ProductType.MONTHLY));
        assertFalse(codec.verifyFormat("garbage", ProductType.MONTHLY));
    }

    @Test
    @DisplayName("Codec refuses to start without a license secret")
    void constructor_RequiresSecret() {
        FulfillmentProperties properties = TestProperties.fulfillmentProperties();
        properties.setLicenseSecret(" ");

        assertThrows(IllegalStateException.class, () -> new LicenseKeyCodec(properties, clock));
    }
}
