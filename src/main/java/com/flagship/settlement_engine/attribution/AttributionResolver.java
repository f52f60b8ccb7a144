package com.flagship.settlement_engine.attribution;

import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.order.Order;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Works out who gets what from a paid order. Pure: no I/O, no clock.
 *
 * Each commission is the gross amount times its share, rounded down to the
 * cent. The fulfiller receives the remainder, so rounding never creates or
 * loses money. A share that rounds to zero is left out of the plan.
 */
@Component
@RequiredArgsConstructor
public class AttributionResolver {

    private static final int MONEY_SCALE = 2;
    private static final BigDecimal FULL = BigDecimal.valueOf(CommissionPolicy.FULL_AMOUNT_BPS);

    private final CommissionPolicy policy;

    public SplitPlan resolve(Order order) {
        BigDecimal gross = order.getGrossAmount().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        List<SplitLine> lines = new ArrayList<>(4);

        addShare(lines, null, EntryKind.PLATFORM_FEE, policy.getPlatformBps(), gross);

        if (isReferralEligible(order)) {
            addShare(lines, order.getReferrerId(), EntryKind.REFERRAL_COMMISSION, policy.getReferralBps(), gross);
        }

        if (order.hasFacilitator()) {
            addShare(lines, order.getFacilitatorId(), EntryKind.FACILITATOR_COMMISSION,
                    policy.getFacilitatorBps(), gross);
        }

        int allocatedBps = lines.stream().mapToInt(SplitLine::getBasisPoints).sum();
        BigDecimal allocated = lines.stream().map(SplitLine::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        lines.add(new SplitLine(order.getFulfillerId(), EntryKind.FULFILLER_PAYOUT,
                CommissionPolicy.FULL_AMOUNT_BPS - allocatedBps, gross.subtract(allocated)));

        return new SplitPlan(order.getId(), gross, List.copyOf(lines));
    }

    /**
     * A referrer who is also the fulfiller or the facilitator of the same
     * order is not paid a second time.
     */
    private boolean isReferralEligible(Order order) {
        UUID referrer = order.getReferrerId();
        return referrer != null
                && !referrer.equals(order.getFulfillerId())
                && !Objects.equals(referrer, order.getFacilitatorId());
    }

    private void addShare(List<SplitLine> lines, UUID beneficiaryId, EntryKind kind, int bps, BigDecimal gross) {
        BigDecimal amount = gross.multiply(BigDecimal.valueOf(bps)).divide(FULL, MONEY_SCALE, RoundingMode.DOWN);
        if (amount.signum() > 0) {
            lines.add(new SplitLine(beneficiaryId, kind, bps, amount));
        }
    }
}
