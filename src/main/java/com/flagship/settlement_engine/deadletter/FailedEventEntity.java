package com.flagship.settlement_engine.deadletter;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the dead-letter log. The payload never changes; only the
 * attempt bookkeeping and resolution columns do.
 */
@Entity
@Table(name = "failed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FailedEventEntity {

    private static final int MAX_ERROR_LENGTH = 4000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_event_id", updatable = false)
    private String externalEventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "raw_payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_class")
    private String errorClass;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_attempt_at", nullable = false)
    private Instant lastAttemptAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    public static FailedEventEntity capture(String externalEventId, String eventType, String rawPayload,
                                            UUID orderId, String errorMessage, String errorClass, int attempts) {
        Instant now = Instant.now();
        return new FailedEventEntity(
            UUID.randomUUID(),
            externalEventId,
            eventType,
            rawPayload,
            truncate(errorMessage),
            errorClass,
            orderId,
            Math.max(attempts, 1),
            now,
            now,
            null,
            null
        );
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    void recordFailedAttempt(String errorMessage, String errorClass) {
        this.attempts++;
        this.errorMessage = truncate(errorMessage);
        this.errorClass = errorClass;
        this.lastAttemptAt = Instant.now();
    }

    void markResolved(String notes) {
        Instant now = Instant.now();
        this.attempts++;
        this.lastAttemptAt = now;
        this.resolvedAt = now;
        this.resolutionNotes = notes;
    }

    public FailedEvent toDomain() {
        return new FailedEvent(id, externalEventId, eventType, rawPayload, errorMessage, errorClass, orderId,
                attempts, createdAt, lastAttemptAt, resolvedAt, resolutionNotes);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
