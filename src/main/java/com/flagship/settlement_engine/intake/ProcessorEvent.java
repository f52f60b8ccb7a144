package com.flagship.settlement_engine.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement_engine.error.MalformedEventException;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * A parsed processor event: envelope fields plus the untyped payload.
 * The raw body is kept verbatim for the dead-letter log and replays.
 */
@Value
public class ProcessorEvent {
    String eventId;
    String eventTypeName;
    ProcessorEventType type;   // null when the type is not one we handle
    JsonNode payload;
    String rawPayload;

    public boolean isHandled() {
        return type != null;
    }

    public String requiredText(String field) {
        return optionalText(field)
            .orElseThrow(() -> new MalformedEventException(
                String.format("Event %s (%s) is missing payload field '%s'", eventId, eventTypeName, field)));
    }

    public Optional<String> optionalText(String field) {
        JsonNode node = payload != null ? payload.get(field) : null;
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    public UUID requiredUuid(String field) {
        return parseUuid(field, requiredText(field));
    }

    public Optional<UUID> optionalUuid(String field) {
        return optionalText(field).map(value -> parseUuid(field, value));
    }

    /**
     * Order id for the dead-letter log, if the payload has a usable one.
     */
    public UUID bestEffortOrderId() {
        try {
            return optionalUuid("order_id").orElse(null);
        } catch (MalformedEventException e) {
            return null;
        }
    }

    private UUID parseUuid(String field, String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(
                String.format("Event %s has an invalid '%s': %s", eventId, field, value), e);
        }
    }
}
