package com.flagship.settlement_engine.payout;

public enum PayoutStatus {
    PAID_OUT,
    PENDING,
    REJECTED
}
