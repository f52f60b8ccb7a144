package com.flagship.settlement_engine.payout.transfer;

import java.util.Arrays;
import java.util.Optional;

/**
 * Transfer status as reported by the transfer API.
 */
public enum TransferStatus {
    PAID("paid"),
    IN_TRANSIT("in_transit"),
    PENDING("pending"),
    FAILED("failed"),
    CANCELED("canceled");

    private final String wireName;

    TransferStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public TransferOutcome outcome() {
        return switch (this) {
            case PAID -> TransferOutcome.SUCCEEDED;
            case IN_TRANSIT, PENDING -> TransferOutcome.PENDING;
            case FAILED, CANCELED -> TransferOutcome.FAILED;
        };
    }

    public static Optional<TransferStatus> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(status -> status.wireName.equalsIgnoreCase(name))
            .findFirst();
    }
}
