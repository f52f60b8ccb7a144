package com.flagship.settlement_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.payout.PayoutResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WithdrawalResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("withdrawal_id")
    UUID withdrawalId;

    @JsonProperty("reason")
    String reason;

    public static WithdrawalResponse from(PayoutResult result) {
        return WithdrawalResponse.builder()
                .status(result.getStatus().name().toLowerCase())
                .withdrawalId(result.getWithdrawalId())
                .reason(result.getReason() != null ? result.getReason().name().toLowerCase() : null)
                .build();
    }
}
