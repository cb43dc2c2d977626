package com.flagship.license_fulfillment.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A message waiting in the transactional outbox.
 *
 * Written in the same transaction as the state change it describes and
 * relayed to Kafka afterwards by {@link OutboxPublisher}. The message key
 * is the recipient, so all messages for one user land on one partition.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String messageKey;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String messageKey, String eventType,
                                     String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, messageKey, eventType, payload,
                now, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
