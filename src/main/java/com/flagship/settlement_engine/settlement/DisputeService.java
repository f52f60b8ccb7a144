package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.error.OrderNotFoundException;
import com.flagship.settlement_engine.error.TransientEventException;
import com.flagship.settlement_engine.event.ChargebackRecordedEvent;
import com.flagship.settlement_engine.ledger.DisputeTally;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.order.OrderStatus;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Freezes an order's unreleased shares when the payer opens a chargeback.
 *
 * Shares still held, and available shares the beneficiary has not withdrawn,
 * move to DISPUTED and stop counting toward balances. Shares already paid out
 * keep their state, so a chargeback never drives a balance negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    private final OrderService orderService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * @param orderId    order id from the event, if present
     * @param paymentRef processor payment reference, used when orderId is absent
     * @return number of entries moved to DISPUTED
     * @throws TransientEventException if the order is not settled yet; the
     *         payment event may still be in flight
     */
    @Transactional
    public int openChargeback(UUID orderId, String paymentRef, String chargebackId) {
        UUID resolvedId = resolveOrderId(orderId, paymentRef);
        Order order = orderService.lockOrder(resolvedId).toDomain();

        if (order.getStatus() != OrderStatus.PAID) {
            throw new TransientEventException(String.format(
                "Chargeback %s for order %s arrived before settlement (status %s)",
                chargebackId, resolvedId, order.getStatus()));
        }

        DisputeTally tally = ledgerService.disputeOrderEntries(resolvedId);
        outboxService.append(ChargebackRecordedEvent.of(resolvedId, chargebackId, tally));
        metrics.recordChargeback();

        log.warn("Chargeback {} recorded for order {}: {} entries disputed, {} already paid out",
                chargebackId, resolvedId, tally.getDisputed(), tally.getAlreadyPaidOut());
        return tally.getDisputed();
    }

    private UUID resolveOrderId(UUID orderId, String paymentRef) {
        if (orderId != null) {
            return orderId;
        }
        if (paymentRef == null) {
            throw new IllegalArgumentException("Chargeback needs an order id or a payment reference");
        }
        return orderService.findByPaymentRef(paymentRef)
            .map(Order::getId)
            .orElseThrow(() -> OrderNotFoundException.forPaymentRef(paymentRef));
    }
}
