package com.flagship.settlement_engine.event;

import com.flagship.settlement_engine.attribution.SplitLine;
import com.flagship.settlement_engine.attribution.SplitPlan;
import com.flagship.settlement_engine.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when an order is settled. Carries each party's share so the
 * notification service can tell every beneficiary what they earned.
 */
@Value
public class OrderSettledEvent implements SettlementEvent {
    UUID eventId;
    UUID orderId;
    String externalPaymentRef;
    BigDecimal grossAmount;
    String currency;
    UUID batchId;
    Instant availableAt;
    List<Share> shares;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderSettled";

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

    public static OrderSettledEvent of(Order order, SplitPlan plan, UUID batchId, Instant availableAt) {
        List<Share> shares = plan.getLines().stream()
            .map(Share::of)
            .toList();
        return new OrderSettledEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getExternalPaymentRef(),
            order.getGrossAmount(),
            order.getCurrency(),
            batchId,
            availableAt,
            shares,
            Instant.now()
        );
    }

    @Value
    public static class Share {
        UUID beneficiaryId;
        String kind;
        BigDecimal amount;

        static Share of(SplitLine line) {
            return new Share(line.getBeneficiaryId(), line.getKind().name(), line.getAmount());
        }
    }
}
