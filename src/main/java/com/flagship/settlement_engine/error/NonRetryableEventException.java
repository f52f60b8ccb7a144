package com.flagship.settlement_engine.error;

/**
 * Failure that will not go away by trying again.
 *
 * Events failing with this exception (or any subclass) are written to the
 * dead-letter log straight away instead of being retried.
 */
public class NonRetryableEventException extends RuntimeException {

    public NonRetryableEventException(String message) {
        super(message);
    }

    public NonRetryableEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
