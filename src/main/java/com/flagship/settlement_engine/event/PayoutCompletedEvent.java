package com.flagship.settlement_engine.event;

import com.flagship.settlement_engine.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PayoutCompletedEvent implements SettlementEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID beneficiaryId;
    BigDecimal amount;
    String externalPayoutRef;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutCompleted";

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

    public static PayoutCompletedEvent of(LedgerEntry withdrawal, String payoutRef) {
        return new PayoutCompletedEvent(
            UUID.randomUUID(),
            withdrawal.getId(),
            withdrawal.getBeneficiaryId(),
            withdrawal.getAmount().abs(),
            payoutRef != null ? payoutRef : withdrawal.getExternalPayoutRef(),
            Instant.now()
        );
    }
}
