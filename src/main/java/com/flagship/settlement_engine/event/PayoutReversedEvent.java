package com.flagship.settlement_engine.event;

import com.flagship.settlement_engine.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a withdrawal failed and its amount was returned to the
 * beneficiary's available balance.
 */
@Value
public class PayoutReversedEvent implements SettlementEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID reversalEntryId;
    UUID beneficiaryId;
    BigDecimal amount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutReversed";

    @Override
    public UUID getAggregateId() {
        return withdrawalId;
    }

    @Override
    public String getAggregateType() {
        return "Withdrawal";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutReversedEvent of(LedgerEntry withdrawal, UUID reversalEntryId, String reason) {
        return new PayoutReversedEvent(
            UUID.randomUUID(),
            withdrawal.getId(),
            reversalEntryId,
            withdrawal.getBeneficiaryId(),
            withdrawal.getAmount().abs(),
            reason,
            Instant.now()
        );
    }
}
