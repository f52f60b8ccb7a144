package com.flagship.settlement_engine.error;

/**
 * Processor event whose body could not be read or lacks a required field.
 */
public class MalformedEventException extends NonRetryableEventException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
