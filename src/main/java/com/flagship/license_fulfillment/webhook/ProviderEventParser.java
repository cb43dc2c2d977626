package com.flagship.license_fulfillment.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Extracts a {@link ProviderEvent} from the provider's JSON body.
 *
 * The product id is {@code items[0].offer.id}, falling back to
 * {@code items[0].productId}. Custom data is looked up in
 * {@code items[0].customFields}, then {@code payment.customFields}, then
 * {@code data.customFields}, and may be an object or a JSON string.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderEventParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public ProviderEvent parse(byte[] rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Webhook body must be a JSON object");
        }

        String rawType = text(root.path("type"));
        JsonNode data = root.path("data");
        JsonNode payment = data.path("payment");
        JsonNode firstItem = data.path("items").path(0);

        String productId = text(firstItem.path("offer").path("id"));
        if (productId == null) {
            productId = text(firstItem.path("productId"));
        }

        return new ProviderEvent(
                ProviderEventType.fromWireName(rawType),
                rawType,
                firstText(payment.path("id"), data.path("payment_id")),
                firstText(data.path("customer").path("id"), data.path("customer_id")),
                amount(payment.path("value")),
                productId,
                customData(List.of(firstItem, payment, data)),
                firstText(data.path("reason"), payment.path("failureReason"))
        );
    }

    private CustomData customData(List<JsonNode> candidates) {
        for (JsonNode candidate : candidates) {
            JsonNode fields = candidate.path("customFields");
            if (fields.isMissingNode() || fields.isNull()) {
                continue;
            }
            if (fields.isTextual()) {
                try {
                    fields = objectMapper.readTree(fields.asText());
                } catch (JsonProcessingException e) {
                    log.warn("Ignoring custom data that is not valid JSON: {}", fields.asText());
                    return CustomData.empty();
                }
            }
            return new CustomData(
                    text(fields.path("userId")),
                    firstText(fields.path("intentId"), fields.path("paymentId")));
        }
        return CustomData.empty();
    }

    private static BigDecimal amount(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable payment amount '{}'", node.asText());
                return null;
            }
        }
        return null;
    }

    private static String firstText(JsonNode first, JsonNode second) {
        String value = text(first);
        return value != null ? value : text(second);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
