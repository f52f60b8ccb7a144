package com.flagship.settlement_engine.payout;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a withdrawal request. withdrawalId is null when the request was
 * rejected before anything was reserved.
 */
@Value
public class PayoutResult {
    PayoutStatus status;
    UUID withdrawalId;
    RejectionReason reason;

    public static PayoutResult paidOut(UUID withdrawalId) {
        return new PayoutResult(PayoutStatus.PAID_OUT, withdrawalId, null);
    }

    public static PayoutResult pending(UUID withdrawalId) {
        return new PayoutResult(PayoutStatus.PENDING, withdrawalId, null);
    }

    public static PayoutResult rejected(UUID withdrawalId, RejectionReason reason) {
        return new PayoutResult(PayoutStatus.REJECTED, withdrawalId, reason);
    }

    public static PayoutResult rejected(RejectionReason reason) {
        return rejected(null, reason);
    }
}
