package com.flagship.settlement_engine.order;

/**
 * Payment state of an order.
 */
public enum OrderStatus {
    /**
     * Registered by the booking flow, no successful payment yet.
     */
    UNPAID,

    /**
     * Settled. Reached exactly once, never left.
     */
    PAID,

    /**
     * The last payment attempt failed. A later successful attempt may still
     * settle the order.
     */
    PAYMENT_FAILED;

    public boolean isSettleable() {
        return this == UNPAID || this == PAYMENT_FAILED;
    }
}
