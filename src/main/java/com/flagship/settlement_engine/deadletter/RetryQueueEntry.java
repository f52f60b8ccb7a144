package com.flagship.settlement_engine.deadletter;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RetryQueueEntry {
    UUID id;
    String externalEventId;
    String eventType;
    String rawPayload;
    UUID orderId;
    int attempts;
    Instant nextAttemptAt;
    String lastError;
    Instant createdAt;
}
