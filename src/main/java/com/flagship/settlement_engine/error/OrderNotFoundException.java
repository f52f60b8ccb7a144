package com.flagship.settlement_engine.error;

import lombok.Getter;

import java.util.UUID;

@Getter
public class OrderNotFoundException extends NonRetryableEventException {

    private final UUID orderId;

    public OrderNotFoundException(UUID orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }

    private OrderNotFoundException(String message) {
        super(message);
        this.orderId = null;
    }

    public static OrderNotFoundException forPaymentRef(String paymentRef) {
        return new OrderNotFoundException("No order paid by " + paymentRef);
    }
}
