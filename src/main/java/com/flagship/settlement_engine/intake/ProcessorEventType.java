package com.flagship.settlement_engine.intake;

import java.util.Arrays;
import java.util.Optional;

/**
 * Processor event types the engine acts on. Anything else is acknowledged
 * and recorded as skipped.
 */
public enum ProcessorEventType {
    PAYMENT_SUCCEEDED("payment.succeeded"),
    PAYMENT_FAILED("payment.failed"),
    TRANSFER_SUCCEEDED("transfer.succeeded"),
    TRANSFER_FAILED("transfer.failed"),
    TRANSFER_CANCELED("transfer.canceled"),
    TRANSFER_UPDATED("transfer.updated"),
    CHARGEBACK_OPENED("chargeback.opened");

    private final String wireName;

    ProcessorEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ProcessorEventType> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(name))
            .findFirst();
    }
}
