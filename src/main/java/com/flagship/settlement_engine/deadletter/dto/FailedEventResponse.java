package com.flagship.settlement_engine.deadletter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.deadletter.FailedEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class FailedEventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_event_id")
    String externalEventId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("error_class")
    String errorClass;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_attempt_at")
    Instant lastAttemptAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    @JsonProperty("raw_payload")
    String rawPayload;

    public static FailedEventResponse from(FailedEvent event) {
        return FailedEventResponse.builder()
                .id(event.getId())
                .externalEventId(event.getExternalEventId())
                .eventType(event.getEventType())
                .orderId(event.getOrderId())
                .errorClass(event.getErrorClass())
                .errorMessage(event.getErrorMessage())
                .attempts(event.getAttempts())
                .createdAt(event.getCreatedAt())
                .lastAttemptAt(event.getLastAttemptAt())
                .resolvedAt(event.getResolvedAt())
                .rawPayload(event.getRawPayload())
                .build();
    }
}
