package com.flagship.settlement_engine.payout.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A transfer to submit. The withdrawal id doubles as the idempotency key, so
 * resubmitting the same withdrawal can never pay twice.
 */
@Value
public class TransferRequest {
    UUID withdrawalId;
    UUID beneficiaryId;
    BigDecimal amount;
    String currency;

    public String getIdempotencyKey() {
        return withdrawalId.toString();
    }
}
