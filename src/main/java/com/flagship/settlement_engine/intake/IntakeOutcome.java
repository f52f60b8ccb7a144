package com.flagship.settlement_engine.intake;

/**
 * What happened to an inbound processor event. Every outcome except a
 * capture failure is acknowledged to the processor with 200.
 */
public enum IntakeOutcome {
    PROCESSED,
    DUPLICATE,
    SKIPPED,
    QUEUED_FOR_RETRY,
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == PROCESSED || this == DUPLICATE || this == SKIPPED;
    }
}
