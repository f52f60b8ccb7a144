package com.flagship.settlement_engine.event;

import com.flagship.settlement_engine.ledger.DisputeTally;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ChargebackRecordedEvent implements SettlementEvent {
    UUID eventId;
    UUID orderId;
    String chargebackId;
    int disputedEntries;
    int paidOutEntries;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ChargebackRecorded";

    @Override
    public UUID getAggregateId() {
        return orderId;
    }

    @Override
    public String getAggregateType() {
        return "Order";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ChargebackRecordedEvent of(UUID orderId, String chargebackId, DisputeTally tally) {
        return new ChargebackRecordedEvent(UUID.randomUUID(), orderId, chargebackId,
                tally.getDisputed(), tally.getAlreadyPaidOut(), Instant.now());
    }
}
