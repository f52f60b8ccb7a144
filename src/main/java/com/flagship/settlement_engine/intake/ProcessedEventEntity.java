package com.flagship.settlement_engine.intake;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-side mapping of processed_events. Inserts go through the native
 * claim statement and the only later write is the detail note, so the
 * entity exposes no setters.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity {

    @Id
    @Column(name = "event_id", updatable = false)
    private String eventId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "detail")
    private String detail;

    ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, processedAt, processingResult, detail);
    }
}
