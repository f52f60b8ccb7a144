package com.flagship.settlement_engine.intake;

/**
 * A failed event could be neither applied nor recorded. The webhook answers
 * 500 so the processor delivers it again.
 */
public class EventCaptureException extends RuntimeException {

    public EventCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
