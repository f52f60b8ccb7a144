package com.flagship.settlement_engine.payout;

public enum RejectionReason {
    INVALID_AMOUNT,
    BELOW_MINIMUM,
    ABOVE_MAXIMUM,
    INSUFFICIENT_FUNDS,
    TRANSFER_DECLINED,
    TRANSFER_UNAVAILABLE
}
