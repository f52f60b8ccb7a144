package com.flagship.settlement_engine.payout.transfer;

public class TransferUnavailableException extends RuntimeException {

    public TransferUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
