package com.flagship.settlement_engine.deadletter;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JDBC access to event_retry_queue.
 *
 * Entries are claimed with a lease: a worker that dies mid-batch leaves its
 * entries to be picked up again once the lease runs out.
 */
@Repository
public class RetryQueueRepository {

    private static final String COLUMNS =
        "id, external_event_id, event_type, raw_payload, order_id, attempts, next_attempt_at, last_error, created_at";

    private final JdbcTemplate jdbcTemplate;

    public RetryQueueRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return false if the event is already queued
     */
    @Transactional
    public boolean enqueue(String externalEventId, String eventType, String rawPayload, UUID orderId,
                           Instant nextAttemptAt, String lastError) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO event_retry_queue (id, external_event_id, event_type, raw_payload, order_id, attempts, " +
            "next_attempt_at, last_error, created_at) VALUES (?, ?, ?, ?, ?, 0, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (external_event_id) DO NOTHING",
            UUID.randomUUID(),
            externalEventId,
            eventType,
            rawPayload,
            orderId,
            Timestamp.from(nextAttemptAt),
            lastError
        );
        return inserted == 1;
    }

    /**
     * Leases up to {@code limit} due entries to {@code owner}. Rows locked by
     * another worker are skipped.
     */
    @Transactional
    public List<RetryQueueEntry> claimDue(String owner, Duration lease, int limit) {
        return jdbcTemplate.query(
            "UPDATE event_retry_queue SET lease_owner = ?, lease_until = ? " +
            "WHERE id IN (" +
            "  SELECT id FROM event_retry_queue " +
            "  WHERE next_attempt_at <= now() AND (lease_until IS NULL OR lease_until < now()) " +
            "  ORDER BY next_attempt_at LIMIT ? FOR UPDATE SKIP LOCKED" +
            ") RETURNING " + COLUMNS,
            rowMapper(),
            owner,
            Timestamp.from(Instant.now().plus(lease)),
            limit
        );
    }

    @Transactional
    public void reschedule(UUID id, int attempts, Instant nextAttemptAt, String lastError) {
        jdbcTemplate.update(
            "UPDATE event_retry_queue SET attempts = ?, next_attempt_at = ?, last_error = ?, " +
            "lease_owner = NULL, lease_until = NULL WHERE id = ?",
            attempts,
            Timestamp.from(nextAttemptAt),
            lastError,
            id
        );
    }

    @Transactional
    public void delete(UUID id) {
        jdbcTemplate.update("DELETE FROM event_retry_queue WHERE id = ?", id);
    }

    public long countPending() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM event_retry_queue", Long.class);
        return count != null ? count : 0L;
    }

    private RowMapper<RetryQueueEntry> rowMapper() {
        return (rs, rowNum) -> {
            String orderId = rs.getString("order_id");
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new RetryQueueEntry(
                UUID.fromString(rs.getString("id")),
                rs.getString("external_event_id"),
                rs.getString("event_type"),
                rs.getString("raw_payload"),
                orderId != null ? UUID.fromString(orderId) : null,
                rs.getInt("attempts"),
                rs.getTimestamp("next_attempt_at").toInstant(),
                rs.getString("last_error"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
