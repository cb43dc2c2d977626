package com.flagship.license_fulfillment.observability;

import com.flagship.license_fulfillment.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for the notification outbox: backlog size, oldest waiting message
 * and dead letters. Values are cached and refreshed by {@link MetricsScheduler}
 * so a Prometheus scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished notifications in the outbox")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished notification in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_letter", deadLetterCount, AtomicLong::get)
                .description("Notifications that exceeded the publish retry limit")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());
            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            deadLetterCount.set(outboxRepository.countDeadLetters(maxRetries));
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
