package com.flagship.settlement_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.ledger.BalanceView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("beneficiary_id")
    UUID beneficiaryId;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("held")
    BigDecimal held;

    @JsonProperty("lifetime_total")
    BigDecimal lifetimeTotal;

    public static BalanceResponse from(BalanceView view) {
        return BalanceResponse.builder()
            .beneficiaryId(view.getBeneficiaryId())
            .available(view.getAvailable().setScale(2, RoundingMode.HALF_UP))
            .held(view.getHeld().setScale(2, RoundingMode.HALF_UP))
            .lifetimeTotal(view.getLifetimeTotal().setScale(2, RoundingMode.HALF_UP))
            .build();
    }
}
