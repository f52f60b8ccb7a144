package com.flagship.settlement_engine.intake;

import lombok.Value;

import java.time.Instant;

/**
 * Record of a processor event that has been applied or deliberately skipped.
 * Its existence is what makes redelivery a no-op.
 */
@Value
public class ProcessedEvent {
    String eventId;
    String eventType;
    Instant processedAt;
    ProcessingResult result;
    String detail;

    public enum ProcessingResult {
        SUCCESS,    // Handler ran and committed
        SKIPPED     // Event type not handled
    }

    public static ProcessedEvent success(String eventId, String eventType) {
        return new ProcessedEvent(eventId, eventType, Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(String eventId, String eventType, String reason) {
        return new ProcessedEvent(eventId, eventType, Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
