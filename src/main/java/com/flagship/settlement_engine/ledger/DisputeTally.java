package com.flagship.settlement_engine.ledger;

import lombok.Value;

/**
 * What a chargeback did to an order's earnings.
 */
@Value
public class DisputeTally {
    /** Entries moved to DISPUTED. */
    int disputed;
    /** AVAILABLE earnings left alone because withdrawals already paid them out. */
    int alreadyPaidOut;
}
