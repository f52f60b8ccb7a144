package com.flagship.settlement_engine.error;

/**
 * Failure expected to clear up on a later attempt, for example a chargeback
 * that arrived before the payment it refers to was settled.
 */
public class TransientEventException extends RuntimeException {

    public TransientEventException(String message) {
        super(message);
    }

    public TransientEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
