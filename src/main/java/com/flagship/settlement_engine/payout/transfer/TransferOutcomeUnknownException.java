package com.flagship.settlement_engine.payout.transfer;

/**
 * The transfer may or may not have gone through: timeout, 5xx, dropped
 * connection. Must be resolved by lookup, never by resubmitting blind.
 */
public class TransferOutcomeUnknownException extends RuntimeException {

    public TransferOutcomeUnknownException(String message) {
        super(message);
    }

    public TransferOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
