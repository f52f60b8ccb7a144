package com.flagship.settlement_engine.payout.transfer;

/**
 * The transfer API rejected the request. Nothing was paid.
 */
public class TransferDeclinedException extends RuntimeException {

    public TransferDeclinedException(String message) {
        super(message);
    }

    public TransferDeclinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
