package com.flagship.settlement_engine.attribution;

import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Commission split: one case per party combination, plus rounding and the
 * referrer-is-already-paid rule.
 */
class AttributionResolverTest {

    private final AttributionResolver resolver = new AttributionResolver(CommissionPolicy.standard());

    private final UUID payer = UUID.randomUUID();
    private final UUID fulfiller = UUID.randomUUID();
    private final UUID referrer = UUID.randomUUID();
    private final UUID facilitator = UUID.randomUUID();

    private Order order(String gross, UUID referrerId, UUID facilitatorId) {
        return Order.register(UUID.randomUUID(), payer, fulfiller, referrerId, facilitatorId,
                new BigDecimal(gross), "USD", Instant.now(), OrderContext.empty());
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                "expected " + expected + " but was " + actual);
    }

    private static void assertShare(SplitPlan plan, EntryKind kind, UUID beneficiary, int bps, String amount) {
        SplitLine line = plan.lineFor(kind).orElseThrow(() -> new AssertionError("missing " + kind));
        assertEquals(beneficiary, line.getBeneficiaryId());
        assertEquals(bps, line.getBasisPoints());
        assertAmount(amount, line.getAmount());
    }

    @Test
    @DisplayName("No referrer, no facilitator: platform 10%, fulfiller 90%")
    void testResolve_PlatformAndFulfillerOnly() {
        SplitPlan plan = resolver.resolve(order("100.00", null, null));

        assertEquals(2, plan.getLines().size());
        assertShare(plan, EntryKind.PLATFORM_FEE, null, 1000, "10.00");
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 9000, "90.00");
        assertEquals(10_000, plan.getTotalBasisPoints());
        assertAmount("100.00", plan.getTotalAmount());
    }

    @Test
    @DisplayName("Referrer only: platform 10%, referral 10%, fulfiller 80%")
    void testResolve_WithReferrer() {
        SplitPlan plan = resolver.resolve(order("100.00", referrer, null));

        assertEquals(3, plan.getLines().size());
        assertShare(plan, EntryKind.PLATFORM_FEE, null, 1000, "10.00");
        assertShare(plan, EntryKind.REFERRAL_COMMISSION, referrer, 1000, "10.00");
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 8000, "80.00");
    }

    @Test
    @DisplayName("Facilitator only: platform 10%, facilitator 20%, fulfiller 70%")
    void testResolve_WithFacilitator() {
        SplitPlan plan = resolver.resolve(order("100.00", null, facilitator));

        assertEquals(3, plan.getLines().size());
        assertShare(plan, EntryKind.PLATFORM_FEE, null, 1000, "10.00");
        assertShare(plan, EntryKind.FACILITATOR_COMMISSION, facilitator, 2000, "20.00");
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 7000, "70.00");
    }

    @Test
    @DisplayName("All parties: platform 10%, referral 10%, facilitator 20%, fulfiller 60%")
    void testResolve_AllParties() {
        SplitPlan plan = resolver.resolve(order("100.00", referrer, facilitator));

        assertEquals(4, plan.getLines().size());
        assertShare(plan, EntryKind.PLATFORM_FEE, null, 1000, "10.00");
        assertShare(plan, EntryKind.REFERRAL_COMMISSION, referrer, 1000, "10.00");
        assertShare(plan, EntryKind.FACILITATOR_COMMISSION, facilitator, 2000, "20.00");
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 6000, "60.00");
        assertAmount("100.00", plan.getTotalAmount());
    }

    @Test
    @DisplayName("Commissions round down; the fulfiller absorbs the remainder")
    void testResolve_RoundingGoesToFulfiller() {
        SplitPlan plan = resolver.resolve(order("33.33", referrer, facilitator));

        assertShare(plan, EntryKind.PLATFORM_FEE, null, 1000, "3.33");
        assertShare(plan, EntryKind.REFERRAL_COMMISSION, referrer, 1000, "3.33");
        assertShare(plan, EntryKind.FACILITATOR_COMMISSION, facilitator, 2000, "6.66");
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 6000, "20.01");
        assertAmount("33.33", plan.getTotalAmount());
    }

    @Test
    @DisplayName("Shares that round to zero are left out")
    void testResolve_TinyOrderOmitsZeroShares() {
        SplitPlan plan = resolver.resolve(order("0.05", referrer, null));

        assertTrue(plan.lineFor(EntryKind.PLATFORM_FEE).isEmpty());
        assertTrue(plan.lineFor(EntryKind.REFERRAL_COMMISSION).isEmpty());
        assertShare(plan, EntryKind.FULFILLER_PAYOUT, fulfiller, 10_000, "0.05");
    }

    @Test
    @DisplayName("A referrer who is the fulfiller or facilitator gets no referral share")
    void testResolve_ReferrerAlreadyParticipating() {
        SplitPlan selfReferred = resolver.resolve(order("100.00", fulfiller, null));
        assertTrue(selfReferred.lineFor(EntryKind.REFERRAL_COMMISSION).isEmpty());
        assertShare(selfReferred, EntryKind.FULFILLER_PAYOUT, fulfiller, 9000, "90.00");

        SplitPlan facilitatorReferred = resolver.resolve(order("100.00", facilitator, facilitator));
        assertTrue(facilitatorReferred.lineFor(EntryKind.REFERRAL_COMMISSION).isEmpty());
        assertShare(facilitatorReferred, EntryKind.FACILITATOR_COMMISSION, facilitator, 2000, "20.00");
        assertShare(facilitatorReferred, EntryKind.FULFILLER_PAYOUT, fulfiller, 7000, "70.00");
    }

    @Test
    @DisplayName("Policy rejects shares that leave nothing for the fulfiller")
    void testCommissionPolicy_RejectsOverAllocation() {
        assertThrows(IllegalArgumentException.class, () -> new CommissionPolicy(5000, 3000, 2000));
        assertThrows(IllegalArgumentException.class, () -> new CommissionPolicy(-1, 1000, 2000));
    }
}
