package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.attribution.AttributionResolver;
import com.flagship.settlement_engine.attribution.SplitLine;
import com.flagship.settlement_engine.attribution.SplitPlan;
import com.flagship.settlement_engine.error.LedgerInconsistencyException;
import com.flagship.settlement_engine.event.OrderSettledEvent;
import com.flagship.settlement_engine.ledger.BatchType;
import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerBatchRequest;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.ledger.PostedBatch;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderEntity;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.order.OrderStatus;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a confirmed payment into ledger entries.
 *
 * One settlement is one transaction: the order moves to PAID, a balanced
 * SETTLEMENT batch is posted (the payment debit plus one credit per share)
 * and an OrderSettled event goes to the outbox. Any failure rolls back all
 * of it.
 *
 * Concurrent settlements of the same order serialize on the order row lock;
 * the loser sees a PAID order and returns ALREADY_SETTLED. The unique
 * settlement-batch index backs this up if the lock is ever bypassed.
 *
 * Shares other than the platform fee are HELD until the fulfillment end
 * time plus the hold duration.
 */
@Service
@Slf4j
public class SettlementEngine {

    private final OrderService orderService;
    private final LedgerService ledgerService;
    private final AttributionResolver attributionResolver;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Duration holdDuration;

    public SettlementEngine(OrderService orderService,
                            LedgerService ledgerService,
                            AttributionResolver attributionResolver,
                            OutboxService outboxService,
                            SettlementMetrics metrics,
                            @Value("${settlement.hold-duration:P7D}") Duration holdDuration) {
        this.orderService = orderService;
        this.ledgerService = ledgerService;
        this.attributionResolver = attributionResolver;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.holdDuration = holdDuration;
    }

    /**
     * Settles an order for a confirmed payment. Idempotent per
     * (orderId, paymentRef).
     *
     * @throws com.flagship.settlement_engine.error.OrderNotFoundException if the order does not exist
     * @throws LedgerInconsistencyException if the order was paid by a different
     *         payment, or is marked paid without a complete settlement
     */
    @Transactional
    public SettlementResult settle(UUID orderId, String paymentRef) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());

        try {
            // Cheap check before taking the row lock
            if (orderService.isSettledBy(orderId, paymentRef)) {
                return alreadySettled(orderService.findOrder(orderId).orElseThrow(), startTime);
            }

            OrderEntity entity = orderService.lockOrder(orderId);
            Order order = entity.toDomain();

            if (order.getStatus() == OrderStatus.PAID) {
                if (!order.isSettledBy(paymentRef)) {
                    metrics.recordSettlement("conflicting_payment");
                    throw new LedgerInconsistencyException(String.format(
                        "Order %s already paid by %s, rejecting payment %s",
                        orderId, order.getExternalPaymentRef(), paymentRef));
                }
                return alreadySettled(order, startTime);
            }

            Instant now = Instant.now();
            Order paid = orderService.applyTransition(entity, order.markPaid(paymentRef, now));
            SplitPlan plan = attributionResolver.resolve(paid);
            Instant releaseAt = paid.getFulfillmentEndTime().plus(holdDuration);

            PostedBatch batch = ledgerService.postBatch(new LedgerBatchRequest(
                BatchType.SETTLEMENT,
                orderId,
                String.format("Settlement of order %s (payment %s)", orderId, paymentRef),
                paid.getContext(),
                buildEntries(paid, plan, now, releaseAt)
            ));

            outboxService.append(OrderSettledEvent.of(paid, plan, batch.getBatchId(), releaseAt));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement("settled");
            metrics.recordLatency("settle", duration);
            log.info("Order settled: batchId={}, gross={}, shares={}, releaseAt={}, duration={}ms",
                    batch.getBatchId(), paid.getGrossAmount(), plan.getLines().size(), releaseAt, duration);

            return SettlementResult.settled(orderId, batch.getBatchId(), batch.getEntryIds());
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    private List<LedgerBatchRequest.EntryLine> buildEntries(Order order, SplitPlan plan,
                                                            Instant now, Instant releaseAt) {
        List<LedgerBatchRequest.EntryLine> entries = new ArrayList<>(plan.getLines().size() + 1);
        entries.add(LedgerBatchRequest.EntryLine.of(
            order.getPayerId(),
            EntryKind.PAYMENT,
            order.getGrossAmount().negate(),
            EntryState.AVAILABLE,
            now,
            String.format("Payment %s for order %s", order.getExternalPaymentRef(), order.getId())
        ));

        for (SplitLine line : plan.getLines()) {
            boolean platform = line.getKind() == EntryKind.PLATFORM_FEE;
            entries.add(LedgerBatchRequest.EntryLine.of(
                line.getBeneficiaryId(),
                line.getKind(),
                line.getAmount(),
                platform ? EntryState.AVAILABLE : EntryState.HELD,
                platform ? now : releaseAt,
                String.format("%s (%d bp) for order %s", describe(line.getKind()), line.getBasisPoints(), order.getId())
            ));
        }
        return entries;
    }

    private SettlementResult alreadySettled(Order order, long startTime) {
        verifyComplete(order);
        metrics.recordSettlement("already_settled");
        metrics.recordLatency("settle", System.currentTimeMillis() - startTime);
        log.info("Order already settled by payment {}", order.getExternalPaymentRef());
        return SettlementResult.alreadySettled(order.getId());
    }

    /**
     * A paid order must carry its payment debit and the fulfiller's credit,
     * summing to zero.
     */
    private void verifyComplete(Order order) {
        List<LedgerEntry> entries = ledgerService.getEntriesForOrder(order.getId());
        boolean hasPayment = entries.stream().anyMatch(e ->
            e.getKind() == EntryKind.PAYMENT && e.getAmount().compareTo(order.getGrossAmount().negate()) == 0);
        boolean hasFulfillerShare = entries.stream().anyMatch(e -> e.getKind() == EntryKind.FULFILLER_PAYOUT);
        BigDecimal total = entries.stream().map(LedgerEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        if (!hasPayment || !hasFulfillerShare || total.signum() != 0) {
            metrics.recordSettlement("inconsistent");
            throw new LedgerInconsistencyException(String.format(
                "Order %s is PAID but its settlement is incomplete: entries=%d, total=%s",
                order.getId(), entries.size(), total));
        }
    }

    private static String describe(EntryKind kind) {
        return switch (kind) {
            case PLATFORM_FEE -> "Platform fee";
            case REFERRAL_COMMISSION -> "Referral commission";
            case FACILITATOR_COMMISSION -> "Facilitator commission";
            case FULFILLER_PAYOUT -> "Fulfiller share";
            default -> kind.name();
        };
    }
}
