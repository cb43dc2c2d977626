package com.flagship.license_fulfillment.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes messages to the outbox inside the caller's transaction.
 *
 * If the business change commits, the message is guaranteed to be written;
 * if it rolls back, so does the message. Publishing happens later in
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Must run inside an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, String messageKey, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, messageKey, eventType,
                serializePayload(payload), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Saved outbox event: type={}, key={}", eventType, messageKey);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForKey(String messageKey) {
        return repository.findByMessageKeyOrderBySequenceNumberAsc(messageKey)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Deletes published events older than the cut-off.
     */
    @Transactional
    public int purgePublishedBefore(Instant before) {
        return repository.deletePublishedEventsBefore(before);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
