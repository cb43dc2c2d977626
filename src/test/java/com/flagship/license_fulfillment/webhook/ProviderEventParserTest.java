package com.flagship.license_fulfillment.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ProviderEventParserTest {

    private final ProviderEventParser parser = new ProviderEventParser(new ObjectMapper());

    private ProviderEvent parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Success event yields payment id, offer id, amount and item custom fields")
    void parse_SuccessEvent() {
        ProviderEvent event = parse("""
            {"type": "payment_success",
             "data": {
               "payment": {"id": "pay_1", "value": "9.00"},
               "customer": {"id": "cus_1"},
               "items": [{"offer": {"id": "offer-monthly"},
                          "customFields": {"userId": "123456789012345678",
                                           "intentId": "5b1f3a8e-2b5c-4d8e-9f2a-1c3d4e5f6a7b"}}]
             }}
            """);

        assertEquals(ProviderEventType.PAYMENT_SUCCESS, event.type());
        assertEquals("pay_1", event.paymentId());
        assertEquals("cus_1", event.customerId());
        assertEquals(new BigDecimal("9.00"), event.amount());
        assertEquals("offer-monthly", event.providerProductId());
        assertEquals("123456789012345678", event.customData().userId());
        assertEquals("5b1f3a8e-2b5c-4d8e-9f2a-1c3d4e5f6a7b", event.customData().intentId());
    }

    @Test
    @DisplayName("Custom fields sent as a JSON string with the legacy paymentId key are understood")
    void parse_StringCustomFieldsWithLegacyKey() {
        ProviderEvent event = parse("""
            {"type": "payment_success",
             "data": {
               "payment": {"id": "pay_2", "customFields": "{\\"userId\\":\\"42\\",\\"paymentId\\":\\"abc\\"}"},
               "items": [{"productId": "offer-lifetime"}]
             }}
            """);

        assertEquals("offer-lifetime", event.providerProductId());
        assertEquals("42", event.customData().userId());
        assertEquals("abc", event.customData().intentId());
    }

    @Test
    @DisplayName("Flat failure payload carries payment id, customer id and reason")
    void parse_FlatFailure() {
        ProviderEvent event = parse("""
            {"type": "payment_failed",
             "data": {"payment_id": "pay_3", "customer_id": "123456789012345678", "reason": "card_declined"}}
            """);

        assertEquals(ProviderEventType.PAYMENT_FAILED, event.type());
        assertEquals("pay_3", event.paymentId());
        assertEquals("123456789012345678", event.customerId());
        assertEquals("card_declined", event.failureReason());
        assertTrue(event.customData().isEmpty());
    }

    @Test
    @DisplayName("Unrecognised event types parse as unknown and keep the raw type")
    void parse_UnknownType() {
        ProviderEvent event = parse("{\"type\": \"subscription_renewed\", \"data\": {}}");

        assertEquals(ProviderEventType.UNKNOWN, event.type());
        assertEquals("subscription_renewed", event.rawType());
        assertNull(event.providerProductId());
    }

    @Test
    @DisplayName("Malformed custom data string is treated as absent")
    void parse_MalformedCustomData() {
        ProviderEvent event = parse("""
            {"type": "payment_success",
             "data": {"payment": {"id": "pay_4"}, "items": [{"productId": "offer-monthly", "customFields": "not json"}]}}
            """);

        assertTrue(event.customData().isEmpty());
    }

    @Test
    @DisplayName("Bodies that are not JSON objects are rejected")
    void parse_RejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> parse("[1,2,3]"));
    }
}
