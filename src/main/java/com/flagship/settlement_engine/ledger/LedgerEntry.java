package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.order.OrderContext;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the append-only ledger. Amount, kind and parties never change
 * after insert; only state, available_at and the payout reference move.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID batchId;
    UUID orderId;
    UUID beneficiaryId;      // null for PLATFORM_FEE
    EntryKind kind;
    BigDecimal amount;       // negative for PAYMENT and WITHDRAWAL
    EntryState state;
    Instant availableAt;
    String externalPayoutRef;
    UUID relatedEntryId;     // reversal -> withdrawal it compensates
    String description;
    OrderContext context;
    long sequenceNumber;
    Instant createdAt;
}
