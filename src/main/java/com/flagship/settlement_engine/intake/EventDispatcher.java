package com.flagship.settlement_engine.intake;

import com.flagship.settlement_engine.error.MalformedEventException;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.payout.PayoutReconciliationService;
import com.flagship.settlement_engine.payout.TransferNotice;
import com.flagship.settlement_engine.payout.transfer.TransferOutcome;
import com.flagship.settlement_engine.payout.transfer.TransferStatus;
import com.flagship.settlement_engine.settlement.DisputeService;
import com.flagship.settlement_engine.settlement.SettlementEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Routes a handled processor event to the service that applies it. Runs
 * inside the transaction opened by {@link IdempotentEventProcessor}.
 */
@Component
@RequiredArgsConstructor
public class EventDispatcher {

    private final SettlementEngine settlementEngine;
    private final OrderService orderService;
    private final DisputeService disputeService;
    private final PayoutReconciliationService payoutReconciliationService;

    /**
     * @return short description of the effect, stored with the processed marker
     */
    public String dispatch(ProcessorEvent event) {
        return switch (event.getType()) {
            case PAYMENT_SUCCEEDED -> onPaymentSucceeded(event);
            case PAYMENT_FAILED -> onPaymentFailed(event);
            case TRANSFER_SUCCEEDED -> onTransfer(event, TransferOutcome.SUCCEEDED);
            case TRANSFER_FAILED, TRANSFER_CANCELED -> onTransfer(event, TransferOutcome.FAILED);
            case TRANSFER_UPDATED -> onTransfer(event, transferStatus(event).outcome());
            case CHARGEBACK_OPENED -> onChargeback(event);
        };
    }

    private String onPaymentSucceeded(ProcessorEvent event) {
        UUID orderId = event.requiredUuid("order_id");
        String paymentRef = event.requiredText("payment_ref");
        return settlementEngine.settle(orderId, paymentRef).describe();
    }

    private String onPaymentFailed(ProcessorEvent event) {
        UUID orderId = event.requiredUuid("order_id");
        String reason = event.optionalText("failure_reason").orElse("payment_failed");
        return orderService.recordPaymentFailure(orderId, reason)
            ? "order " + orderId + " marked payment failed"
            : "order " + orderId + " already paid, failure ignored";
    }

    private String onTransfer(ProcessorEvent event, TransferOutcome outcome) {
        UUID withdrawalId = event.optionalUuid("withdrawal_id").orElse(null);
        String transferId = event.optionalText("transfer_id").orElse(null);
        if (withdrawalId == null && transferId == null) {
            throw new MalformedEventException(String.format(
                "Event %s has neither withdrawal_id nor transfer_id", event.getEventId()));
        }
        String reason = event.optionalText("failure_reason")
            .orElse(event.getEventTypeName().replace('.', '_'));
        return payoutReconciliationService.reconcile(new TransferNotice(withdrawalId, transferId, outcome, reason));
    }

    private String onChargeback(ProcessorEvent event) {
        String chargebackId = event.requiredText("chargeback_id");
        UUID orderId = event.optionalUuid("order_id").orElse(null);
        String paymentRef = event.optionalText("payment_ref").orElse(null);
        if (orderId == null && paymentRef == null) {
            throw new MalformedEventException(String.format(
                "Chargeback event %s has neither order_id nor payment_ref", event.getEventId()));
        }
        int disputed = disputeService.openChargeback(orderId, paymentRef, chargebackId);
        return "chargeback " + chargebackId + " disputed " + disputed + " entries";
    }

    private static TransferStatus transferStatus(ProcessorEvent event) {
        String status = event.requiredText("status");
        return TransferStatus.fromWireName(status)
            .orElseThrow(() -> new MalformedEventException(String.format(
                "Event %s has unknown transfer status '%s'", event.getEventId(), status)));
    }
}
