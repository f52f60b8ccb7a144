package com.flagship.settlement_engine.error;

/**
 * The ledger and the incoming instruction disagree in a way that needs a human:
 * a second payment for a settled order, a partially written settlement, a
 * success report for a withdrawal that was already reversed.
 */
public class LedgerInconsistencyException extends NonRetryableEventException {

    public LedgerInconsistencyException(String message) {
        super(message);
    }
}
