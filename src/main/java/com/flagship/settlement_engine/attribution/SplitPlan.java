package com.flagship.settlement_engine.attribution;

import com.flagship.settlement_engine.ledger.EntryKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered shares of one order: platform, referral, facilitator, fulfiller.
 * Shares sum to 10000 bp and their amounts to the gross amount.
 */
@Value
public class SplitPlan {
    UUID orderId;
    BigDecimal grossAmount;
    List<SplitLine> lines;

    public BigDecimal getTotalAmount() {
        return lines.stream()
            .map(SplitLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int getTotalBasisPoints() {
        return lines.stream().mapToInt(SplitLine::getBasisPoints).sum();
    }

    public Optional<SplitLine> lineFor(EntryKind kind) {
        return lines.stream().filter(line -> line.getKind() == kind).findFirst();
    }
}
