package com.flagship.settlement_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published through the outbox after a ledger change commits.
 * Consumers deduplicate on {@link #getEventId()}.
 */
public interface SettlementEvent {

    UUID getEventId();

    /**
     * Aggregate the event is about: an order or a withdrawal entry.
     * Also used as the Kafka key, so events of one aggregate stay ordered.
     */
    UUID getAggregateId();

    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
