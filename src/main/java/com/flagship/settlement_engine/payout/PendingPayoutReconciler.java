package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.payout.transfer.TransferClient;
import com.flagship.settlement_engine.payout.transfer.TransferReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resolves withdrawals whose transfer outcome is still open.
 *
 * For each open withdrawal older than the grace period the transfer API is
 * asked, by withdrawal id, what happened. A transfer the API has never heard
 * of is reversed once the withdrawal is old enough that it cannot still be
 * in flight.
 */
@Component
@ConditionalOnProperty(name = "settlement.payout.reconciler.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PendingPayoutReconciler {

    private static final int BATCH_SIZE = 50;

    private final LedgerService ledgerService;
    private final TransferClient transferClient;
    private final PayoutReconciliationService reconciliationService;
    private final PayoutLedgerService payoutLedger;
    private final Duration pendingGrace;
    private final Duration notFoundReversalAfter;

    public PendingPayoutReconciler(LedgerService ledgerService,
                                   TransferClient transferClient,
                                   PayoutReconciliationService reconciliationService,
                                   PayoutLedgerService payoutLedger,
                                   @Value("${settlement.payout.pending-grace:PT10M}") Duration pendingGrace,
                                   @Value("${settlement.payout.not-found-reversal-after:PT24H}") Duration notFoundReversalAfter) {
        this.ledgerService = ledgerService;
        this.transferClient = transferClient;
        this.reconciliationService = reconciliationService;
        this.payoutLedger = payoutLedger;
        this.pendingGrace = pendingGrace;
        this.notFoundReversalAfter = notFoundReversalAfter;
    }

    @Scheduled(fixedDelayString = "${settlement.payout.reconcile-interval-ms:60000}")
    public void run() {
        CorrelationContext.openBackground();
        try {
            reconcilePending();
        } catch (Exception e) {
            log.error("Pending payout reconciliation failed: {}", e.getMessage(), e);
        } finally {
            CorrelationContext.close();
        }
    }

    /**
     * @return number of withdrawals whose state was resolved in this pass
     */
    public int reconcilePending() {
        Instant now = Instant.now();
        List<LedgerEntry> open = ledgerService.findOpenWithdrawals(now.minus(pendingGrace), BATCH_SIZE);
        int resolved = 0;

        for (LedgerEntry withdrawal : open) {
            try {
                Optional<TransferReceipt> receipt = transferClient.lookup(withdrawal.getId());
                if (receipt.isPresent()) {
                    String detail = reconciliationService.reconcile(new TransferNotice(
                        withdrawal.getId(),
                        receipt.get().getTransferId(),
                        receipt.get().getStatus().outcome(),
                        "transfer_" + receipt.get().getStatus().getWireName()));
                    log.info("Reconciled withdrawal {}: {}", withdrawal.getId(), detail);
                    resolved++;
                } else if (withdrawal.getCreatedAt().isBefore(now.minus(notFoundReversalAfter))) {
                    payoutLedger.reverseWithdrawal(withdrawal.getId(), "transfer_not_found");
                    resolved++;
                } else {
                    log.debug("No transfer yet for withdrawal {}", withdrawal.getId());
                }
            } catch (Exception e) {
                log.warn("Could not reconcile withdrawal {}: {}", withdrawal.getId(), e.getMessage());
            }
        }

        if (!open.isEmpty()) {
            log.info("Pending payout pass: open={}, resolved={}", open.size(), resolved);
        }
        return resolved;
    }
}
