package com.flagship.settlement_engine.intake.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.intake.IntakeOutcome;
import lombok.Value;

@Value
public class WebhookAckResponse {

    @JsonProperty("received")
    boolean received;

    @JsonProperty("outcome")
    String outcome;

    public static WebhookAckResponse of(IntakeOutcome outcome) {
        return new WebhookAckResponse(true, outcome.name().toLowerCase());
    }
}
