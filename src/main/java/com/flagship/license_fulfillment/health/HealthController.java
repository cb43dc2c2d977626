package com.flagship.license_fulfillment.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for load balancers and uptime checks. Unlike the
 * Actuator health endpoint, this needs no authorization.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Instant now = clock.instant();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("timestamp", now.toString());
        response.put("uptimeSeconds", Math.max(0, Duration.between(startedAt, now).getSeconds()));

        if (!checkDatabase()) {
            response.put("status", "unhealthy");
            response.put("database", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
