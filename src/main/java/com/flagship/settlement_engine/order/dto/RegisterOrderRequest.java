package com.flagship.settlement_engine.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Order registration sent by the booking flow once a booking is confirmed.
 */
@Value
public class RegisterOrderRequest {

    @JsonProperty("order_id")
    UUID orderId;

    @NotNull(message = "Payer ID is required")
    @JsonProperty("payer_id")
    UUID payerId;

    @NotNull(message = "Fulfiller ID is required")
    @JsonProperty("fulfiller_id")
    UUID fulfillerId;

    @JsonProperty("referrer_id")
    UUID referrerId;

    @JsonProperty("facilitator_id")
    UUID facilitatorId;

    @NotNull(message = "Gross amount is required")
    @DecimalMin(value = "0.01", message = "Gross amount must be greater than 0")
    @Digits(integer = 15, fraction = 2, message = "Gross amount must have at most 2 decimal places")
    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @NotNull(message = "Fulfillment end time is required")
    @JsonProperty("fulfillment_end_time")
    Instant fulfillmentEndTime;

    @JsonProperty("service_name")
    String serviceName;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("payer_name")
    String payerName;

    @JsonProperty("fulfiller_name")
    String fulfillerName;

    @JsonProperty("facilitator_name")
    String facilitatorName;
}
