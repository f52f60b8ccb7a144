package com.flagship.settlement_engine.deadletter;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An inbound event that could not be applied, kept verbatim for inspection
 * and replay.
 */
@Value
public class FailedEvent {
    UUID id;
    String externalEventId;
    String eventType;
    String rawPayload;
    String errorMessage;
    String errorClass;
    UUID orderId;
    int attempts;
    Instant createdAt;
    Instant lastAttemptAt;
    Instant resolvedAt;
    String resolutionNotes;

    public boolean isResolved() {
        return resolvedAt != null;
    }
}
