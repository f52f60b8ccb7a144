package com.flagship.settlement_engine.ledger;

/**
 * Lifecycle of a ledger entry. The database trigger on ledger_entries
 * enforces the same transitions as {@link #canTransitionTo(EntryState)}.
 */
public enum EntryState {
    /**
     * Earned but not yet withdrawable; matures at available_at.
     */
    HELD,

    /**
     * Counts towards the withdrawable balance.
     */
    AVAILABLE,

    /**
     * Withdrawal whose transfer was submitted but not confirmed either way.
     */
    PENDING_CONFIRMATION,

    /**
     * Withdrawal confirmed by the transfer provider.
     */
    PAID_OUT,

    /**
     * Frozen by a chargeback; needs manual resolution.
     */
    DISPUTED,

    /**
     * Withdrawal that failed and was compensated by a REVERSAL entry.
     */
    REVERSED;

    public boolean canTransitionTo(EntryState next) {
        return switch (this) {
            case HELD -> next == AVAILABLE || next == DISPUTED;
            case AVAILABLE -> next == PAID_OUT || next == PENDING_CONFIRMATION
                    || next == DISPUTED || next == REVERSED;
            case PENDING_CONFIRMATION -> next == PAID_OUT || next == REVERSED;
            case PAID_OUT -> next == REVERSED;
            case DISPUTED, REVERSED -> false;
        };
    }
}
