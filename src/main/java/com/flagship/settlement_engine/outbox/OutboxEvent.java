package com.flagship.settlement_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A settlement event as stored in outbox_events. The aggregate is either an
 * order (settled, charged back) or a withdrawal (paid out, reversed).
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    /** Database-assigned; null until the row is inserted. */
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
