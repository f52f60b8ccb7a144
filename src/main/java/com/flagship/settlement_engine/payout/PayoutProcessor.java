package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.payout.transfer.TransferClient;
import com.flagship.settlement_engine.payout.transfer.TransferDeclinedException;
import com.flagship.settlement_engine.payout.transfer.TransferOutcome;
import com.flagship.settlement_engine.payout.transfer.TransferOutcomeUnknownException;
import com.flagship.settlement_engine.payout.transfer.TransferReceipt;
import com.flagship.settlement_engine.payout.transfer.TransferRequest;
import com.flagship.settlement_engine.payout.transfer.TransferUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Handles a beneficiary's withdrawal request.
 *
 * Flow:
 * 1. Validate the amount against the configured bounds
 * 2. Reserve the funds in the ledger (short transaction, balance checked under lock)
 * 3. Call the transfer API with no database transaction open
 * 4. Record the outcome in a second short transaction
 *
 * A declined or never-sent transfer is reversed straight away. An unknown
 * outcome leaves the reservation in place for {@link PendingPayoutReconciler},
 * which resolves it by lookup and never by resubmitting.
 */
@Service
@Slf4j
public class PayoutProcessor {

    private final PayoutLedgerService payoutLedger;
    private final TransferClient transferClient;
    private final SettlementMetrics metrics;
    private final BigDecimal minimumAmount;
    private final BigDecimal maximumAmount;
    private final String currency;

    public PayoutProcessor(PayoutLedgerService payoutLedger,
                           TransferClient transferClient,
                           SettlementMetrics metrics,
                           @Value("${settlement.payout.minimum-amount:10.00}") BigDecimal minimumAmount,
                           @Value("${settlement.payout.maximum-amount:10000.00}") BigDecimal maximumAmount,
                           @Value("${settlement.currency:USD}") String currency) {
        this.payoutLedger = payoutLedger;
        this.transferClient = transferClient;
        this.metrics = metrics;
        this.minimumAmount = minimumAmount;
        this.maximumAmount = maximumAmount;
        this.currency = currency;
    }

    public PayoutResult withdraw(UUID beneficiaryId, BigDecimal amount) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.BENEFICIARY_ID_MDC_KEY, beneficiaryId.toString());

        try {
            Optional<RejectionReason> invalid = validate(amount);
            if (invalid.isPresent()) {
                return record(PayoutResult.rejected(invalid.get()), startTime);
            }

            Optional<LedgerEntry> reserved = payoutLedger.reserveWithdrawal(beneficiaryId, amount);
            if (reserved.isEmpty()) {
                return record(PayoutResult.rejected(RejectionReason.INSUFFICIENT_FUNDS), startTime);
            }
            UUID withdrawalId = reserved.get().getId();

            return record(submitTransfer(withdrawalId, beneficiaryId, amount), startTime);
        } finally {
            MDC.remove(CorrelationContext.BENEFICIARY_ID_MDC_KEY);
        }
    }

    private PayoutResult submitTransfer(UUID withdrawalId, UUID beneficiaryId, BigDecimal amount) {
        TransferReceipt receipt;
        try {
            receipt = transferClient.submit(new TransferRequest(withdrawalId, beneficiaryId, amount, currency));
        } catch (TransferDeclinedException e) {
            payoutLedger.reverseWithdrawal(withdrawalId, "transfer_declined");
            return PayoutResult.rejected(withdrawalId, RejectionReason.TRANSFER_DECLINED);
        } catch (TransferUnavailableException e) {
            payoutLedger.reverseWithdrawal(withdrawalId, "transfer_unavailable");
            return PayoutResult.rejected(withdrawalId, RejectionReason.TRANSFER_UNAVAILABLE);
        } catch (TransferOutcomeUnknownException e) {
            log.warn("Transfer outcome unknown, withdrawal {} left for reconciliation: {}",
                    withdrawalId, e.getMessage());
            markPending(withdrawalId, null);
            return PayoutResult.pending(withdrawalId);
        }

        TransferOutcome outcome = receipt.getStatus().outcome();
        try {
            switch (outcome) {
                case SUCCEEDED:
                    payoutLedger.completeWithdrawal(withdrawalId, receipt.getTransferId());
                    return PayoutResult.paidOut(withdrawalId);
                case FAILED:
                    payoutLedger.reverseWithdrawal(withdrawalId, "transfer_" + receipt.getStatus().getWireName());
                    return PayoutResult.rejected(withdrawalId, RejectionReason.TRANSFER_DECLINED);
                default:
                    payoutLedger.markPendingConfirmation(withdrawalId, receipt.getTransferId());
                    return PayoutResult.pending(withdrawalId);
            }
        } catch (RuntimeException e) {
            // The transfer happened; the reconciler will record it from a lookup
            log.error("Failed to record transfer {} for withdrawal {}: {}",
                    receipt.getTransferId(), withdrawalId, e.getMessage(), e);
            return PayoutResult.pending(withdrawalId);
        }
    }

    /**
     * The reconciler also picks up AVAILABLE withdrawals past the grace
     * period, so a failure here only delays resolution.
     */
    private void markPending(UUID withdrawalId, String transferId) {
        try {
            payoutLedger.markPendingConfirmation(withdrawalId, transferId);
        } catch (RuntimeException e) {
            log.error("Could not mark withdrawal {} pending confirmation: {}", withdrawalId, e.getMessage(), e);
        }
    }

    private Optional<RejectionReason> validate(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0 || amount.stripTrailingZeros().scale() > 2) {
            return Optional.of(RejectionReason.INVALID_AMOUNT);
        }
        if (amount.compareTo(minimumAmount) < 0) {
            return Optional.of(RejectionReason.BELOW_MINIMUM);
        }
        if (amount.compareTo(maximumAmount) > 0) {
            return Optional.of(RejectionReason.ABOVE_MAXIMUM);
        }
        return Optional.empty();
    }

    private PayoutResult record(PayoutResult result, long startTime) {
        metrics.recordPayout(result.getStatus().name(), result.getReason() != null ? result.getReason().name() : null);
        metrics.recordLatency("withdraw", System.currentTimeMillis() - startTime);
        log.info("Withdrawal request finished: status={}, withdrawalId={}, reason={}",
                result.getStatus(), result.getWithdrawalId(), result.getReason());
        return result;
    }
}
