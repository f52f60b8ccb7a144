package com.flagship.settlement_engine.ledger;

/**
 * What a ledger entry represents. PAYMENT and WITHDRAWAL are debits (negative
 * amounts); every other kind is a credit.
 */
public enum EntryKind {
    PAYMENT,
    FULFILLER_PAYOUT,
    REFERRAL_COMMISSION,
    FACILITATOR_COMMISSION,
    PLATFORM_FEE,
    WITHDRAWAL,
    REVERSAL;

    public boolean isDebit() {
        return this == PAYMENT || this == WITHDRAWAL;
    }

    /**
     * Credits earned by a party from a settled order.
     */
    public boolean isEarning() {
        return this == FULFILLER_PAYOUT || this == REFERRAL_COMMISSION || this == FACILITATOR_COMMISSION;
    }
}
