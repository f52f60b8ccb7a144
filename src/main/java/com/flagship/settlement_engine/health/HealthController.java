package com.flagship.settlement_engine.health;

import com.flagship.settlement_engine.deadletter.FailedEventRepository;
import com.flagship.settlement_engine.deadletter.RetryQueueRepository;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for load balancers that cannot reach Actuator.
 *
 * DOWN (503) only when PostgreSQL is unreachable: every other backlog is
 * reported for operators but does not take the instance out of rotation.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final FailedEventRepository failedEventRepository;
    private final RetryQueueRepository retryQueueRepository;
    private final OutboxService outboxService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.warn("Health check: database unreachable: {}", e.getMessage());
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("status", "UP");
        body.put("database", "UP");
        body.put("unresolvedFailedEvents", failedEventRepository.countByResolvedAtIsNull());
        body.put("retryQueueDepth", retryQueueRepository.countPending());
        body.put("unpublishedOutboxEvents", outboxService.countUnpublished());
        return ResponseEntity.ok(body);
    }
}
