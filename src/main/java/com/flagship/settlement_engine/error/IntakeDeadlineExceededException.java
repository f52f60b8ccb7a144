package com.flagship.settlement_engine.error;

import java.time.Duration;

public class IntakeDeadlineExceededException extends TransientEventException {

    public IntakeDeadlineExceededException(String eventId, Duration deadline) {
        super(String.format("Event %s not processed within %s", eventId, deadline));
    }
}
