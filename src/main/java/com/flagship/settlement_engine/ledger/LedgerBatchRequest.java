package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.order.OrderContext;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A group of entries written atomically as one batch.
 */
@Value
public class LedgerBatchRequest {
    BatchType batchType;
    UUID orderId;
    String description;
    OrderContext context;
    List<EntryLine> entries;

    public BigDecimal getTotal() {
        return entries.stream()
            .map(EntryLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getTotal().compareTo(BigDecimal.ZERO) == 0;
    }

    @Value
    public static class EntryLine {
        UUID beneficiaryId;
        EntryKind kind;
        BigDecimal amount;
        EntryState state;
        Instant availableAt;
        UUID relatedEntryId;
        String description;

        public static EntryLine of(UUID beneficiaryId, EntryKind kind, BigDecimal amount,
                                   EntryState state, Instant availableAt, String description) {
            return new EntryLine(beneficiaryId, kind, amount, state, availableAt, null, description);
        }

        public static EntryLine reversalOf(LedgerEntry withdrawal, Instant now, String description) {
            return new EntryLine(withdrawal.getBeneficiaryId(), EntryKind.REVERSAL, withdrawal.getAmount().abs(),
                    EntryState.AVAILABLE, now, withdrawal.getId(), description);
        }
    }
}
