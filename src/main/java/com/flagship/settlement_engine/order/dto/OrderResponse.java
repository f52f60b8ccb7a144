package com.flagship.settlement_engine.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OrderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payer_id")
    UUID payerId;

    @JsonProperty("fulfiller_id")
    UUID fulfillerId;

    @JsonProperty("referrer_id")
    UUID referrerId;

    @JsonProperty("facilitator_id")
    UUID facilitatorId;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("external_payment_ref")
    String externalPaymentRef;

    @JsonProperty("fulfillment_end_time")
    Instant fulfillmentEndTime;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("failure_reason")
    String failureReason;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
            .id(order.getId())
            .payerId(order.getPayerId())
            .fulfillerId(order.getFulfillerId())
            .referrerId(order.getReferrerId())
            .facilitatorId(order.getFacilitatorId())
            .grossAmount(order.getGrossAmount())
            .currency(order.getCurrency())
            .status(order.getStatus())
            .externalPaymentRef(order.getExternalPaymentRef())
            .fulfillmentEndTime(order.getFulfillmentEndTime())
            .paidAt(order.getPaidAt())
            .failureReason(order.getFailureReason())
            .build();
    }
}
