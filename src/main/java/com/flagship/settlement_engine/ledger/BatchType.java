package com.flagship.settlement_engine.ledger;

/**
 * The atomic operation that wrote a group of entries. Only settlement batches
 * are required to sum to zero; withdrawals and reversals move money across the
 * ledger boundary.
 */
public enum BatchType {
    SETTLEMENT,
    WITHDRAWAL,
    REVERSAL
}
