package com.flagship.settlement_engine.payout.transfer;

/**
 * What a transfer status means for the withdrawal entry behind it.
 */
public enum TransferOutcome {
    SUCCEEDED,
    PENDING,
    FAILED
}
