package com.flagship.license_fulfillment.observability;

import com.flagship.license_fulfillment.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health checks beyond the built-in datasource one.
 */
public class HealthIndicators {

    /**
     * Notifications are still recorded while Kafka is down, but a growing
     * backlog means users are not hearing about their licenses.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 500;
        static final long BACKLOG_CRITICAL_THRESHOLD = 5000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the webhook idempotency fast path, so an outage is
     * reported as DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Webhook idempotency falls back to the database")
                    .build();
        }
    }
}
