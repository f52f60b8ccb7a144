package com.flagship.settlement_engine.attribution;

import com.flagship.settlement_engine.ledger.EntryKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One beneficiary's share of an order. beneficiaryId is null for the platform.
 */
@Value
public class SplitLine {
    UUID beneficiaryId;
    EntryKind kind;
    int basisPoints;
    BigDecimal amount;
}
