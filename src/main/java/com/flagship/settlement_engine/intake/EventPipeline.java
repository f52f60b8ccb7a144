package com.flagship.settlement_engine.intake;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * One attempt at applying an event: idempotency claim, dispatch, commit.
 * Errors propagate; deciding what to do with them is the caller's job.
 * Shared by live intake, the retry queue and dead-letter replays.
 */
@Component
@RequiredArgsConstructor
public class EventPipeline {

    private final ProcessorEventParser parser;
    private final IdempotentEventProcessor processor;
    private final EventDispatcher dispatcher;

    public IntakeOutcome apply(ProcessorEvent event) {
        if (!event.isHandled()) {
            return processor.skip(event, "Unhandled event type: " + event.getEventTypeName());
        }
        return processor.process(event, () -> dispatcher.dispatch(event));
    }

    /**
     * Parses and applies a stored raw payload.
     *
     * @throws com.flagship.settlement_engine.error.MalformedEventException if the payload does not parse
     */
    public IntakeOutcome apply(String rawPayload) {
        return apply(parser.parse(rawPayload));
    }
}
