package com.flagship.settlement_engine.order;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Order domain object: one purchased service, paid once.
 *
 * Transitions return new instances; the persistence layer copies the mutable
 * fields back onto the entity.
 */
@Value
public class Order {
    UUID id;
    UUID payerId;
    UUID fulfillerId;
    UUID referrerId;
    UUID facilitatorId;
    BigDecimal grossAmount;
    String currency;
    OrderStatus status;
    String externalPaymentRef;
    Instant fulfillmentEndTime;
    OrderContext context;
    String failureReason;
    Instant paidAt;

    public static Order register(UUID id, UUID payerId, UUID fulfillerId, UUID referrerId, UUID facilitatorId,
                                 BigDecimal grossAmount, String currency, Instant fulfillmentEndTime,
                                 OrderContext context) {
        if (grossAmount == null || grossAmount.signum() <= 0) {
            throw new IllegalArgumentException("Gross amount must be positive");
        }
        if (grossAmount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Gross amount has more than 2 decimal places: " + grossAmount);
        }
        if (payerId == null || fulfillerId == null) {
            throw new IllegalArgumentException("Payer and fulfiller are required");
        }
        if (payerId.equals(fulfillerId)) {
            throw new IllegalArgumentException("Payer and fulfiller must be different parties");
        }
        if (fulfillmentEndTime == null) {
            throw new IllegalArgumentException("Fulfillment end time is required");
        }
        return new Order(id, payerId, fulfillerId, referrerId, facilitatorId,
                grossAmount.setScale(2), currency, OrderStatus.UNPAID, null,
                fulfillmentEndTime, context == null ? OrderContext.empty() : context, null, null);
    }

    /**
     * Marks the order as settled by the given processor payment.
     *
     * @throws IllegalStateException if the order is already paid
     */
    public Order markPaid(String paymentRef, Instant at) {
        if (!status.isSettleable()) {
            throw new IllegalStateException(
                String.format("Cannot settle order %s in %s status", id, status));
        }
        return new Order(id, payerId, fulfillerId, referrerId, facilitatorId, grossAmount, currency,
                OrderStatus.PAID, paymentRef, fulfillmentEndTime, context, null, at);
    }

    /**
     * Records a failed payment attempt. Has no effect on a paid order.
     */
    public Order markPaymentFailed(String reason) {
        if (status == OrderStatus.PAID) {
            return this;
        }
        return new Order(id, payerId, fulfillerId, referrerId, facilitatorId, grossAmount, currency,
                OrderStatus.PAYMENT_FAILED, externalPaymentRef, fulfillmentEndTime, context, reason, paidAt);
    }

    public boolean isSettledBy(String paymentRef) {
        return status == OrderStatus.PAID && Objects.equals(externalPaymentRef, paymentRef);
    }

    public boolean hasReferrer() {
        return referrerId != null;
    }

    public boolean hasFacilitator() {
        return facilitatorId != null;
    }
}
