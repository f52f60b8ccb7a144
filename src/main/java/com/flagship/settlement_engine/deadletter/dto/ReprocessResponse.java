package com.flagship.settlement_engine.deadletter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.deadletter.ReprocessResult;
import lombok.Value;

import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReprocessResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    String status;

    @JsonProperty("detail")
    String detail;

    public static ReprocessResponse from(ReprocessResult result) {
        return new ReprocessResponse(result.getFailedEventId(), result.getStatus().name().toLowerCase(), result.getDetail());
    }
}
