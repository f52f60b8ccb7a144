package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Derived balance of one beneficiary. Never stored.
 *
 * available: cleared credits minus withdrawals that have not been reversed.
 * held: earnings still in their hold period.
 * lifetimeTotal: all earnings ever credited, excluding disputed ones.
 */
@Value
public class BalanceView {
    UUID beneficiaryId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal lifetimeTotal;
}
