package com.flagship.settlement_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class WithdrawalRequest {

    @NotNull(message = "beneficiary_id is required")
    @JsonProperty("beneficiary_id")
    UUID beneficiaryId;

    @NotNull(message = "amount is required")
    @JsonProperty("amount")
    BigDecimal amount;
}
