package com.flagship.settlement_engine.deadletter;

import lombok.Value;

import java.util.UUID;

@Value
public class ReprocessResult {
    UUID failedEventId;
    Status status;
    String detail;

    public enum Status {
        RESOLVED,
        ALREADY_RESOLVED,
        FAILED
    }

    public static ReprocessResult resolved(UUID id, String detail) {
        return new ReprocessResult(id, Status.RESOLVED, detail);
    }

    public static ReprocessResult alreadyResolved(UUID id) {
        return new ReprocessResult(id, Status.ALREADY_RESOLVED, null);
    }

    public static ReprocessResult failed(UUID id, String detail) {
        return new ReprocessResult(id, Status.FAILED, detail);
    }
}
