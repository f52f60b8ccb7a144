package com.flagship.settlement_engine.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.error.MalformedEventException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the processor envelope {@code {event_id, event_type, payload}}.
 */
@Component
@RequiredArgsConstructor
public class ProcessorEventParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws MalformedEventException if the body is not a JSON object or
     *         lacks event_id or event_type
     */
    public ProcessorEvent parse(String rawPayload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Event body is not a JSON object");
        }

        String eventId = text(root, "event_id");
        String eventType = text(root, "event_type");
        if (eventId == null || eventType == null) {
            throw new MalformedEventException("Event envelope requires event_id and event_type");
        }

        JsonNode payload = root.get("payload");
        return new ProcessorEvent(
            eventId,
            eventType,
            ProcessorEventType.fromWireName(eventType).orElse(null),
            payload != null && payload.isObject() ? payload : objectMapper.createObjectNode(),
            rawPayload
        );
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
