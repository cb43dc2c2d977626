package com.flagship.license_fulfillment.outbox;

import com.flagship.license_fulfillment.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Relays outbox messages to the notifications topic.
 *
 * Sends are synchronous so messages for the same recipient keep their order.
 * A failed send bumps the retry count; after {@code max-retries} the message
 * is left in place as a dead letter for manual follow-up.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.notifications:license-notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(notificationsTopic, event.getMessageKey(), event.getPayload())
                    .get();

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}) and is now a dead letter. eventType={}, key={}",
                        event.getId(), maxRetries, event.getEventType(), event.getMessageKey());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
