package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.error.NonRetryableEventException;
import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Applies a transfer's final or interim status to its withdrawal entry.
 * Shared by the transfer webhooks and the pending-payout poller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutReconciliationService {

    private final LedgerService ledgerService;
    private final PayoutLedgerService payoutLedger;

    /**
     * @return short description of what changed
     * @throws NonRetryableEventException if no withdrawal matches the notice
     */
    @Transactional
    public String reconcile(TransferNotice notice) {
        LedgerEntry withdrawal = findWithdrawal(notice)
            .orElseThrow(() -> new NonRetryableEventException(String.format(
                "No withdrawal for transfer %s (withdrawal id %s)", notice.getTransferId(), notice.getWithdrawalId())));
        UUID withdrawalId = withdrawal.getId();

        switch (notice.getOutcome()) {
            case SUCCEEDED:
                boolean completed = payoutLedger.completeWithdrawal(withdrawalId, notice.getTransferId());
                return completed ? "withdrawal " + withdrawalId + " paid out" : "withdrawal " + withdrawalId + " already paid out";
            case FAILED:
                String reason = notice.getReason() != null ? notice.getReason() : "transfer_failed";
                return payoutLedger.reverseWithdrawal(withdrawalId, reason)
                    .map(reversalId -> "withdrawal " + withdrawalId + " reversed by " + reversalId)
                    .orElse("withdrawal " + withdrawalId + " already reversed");
            case PENDING:
            default:
                boolean marked = payoutLedger.markPendingConfirmation(withdrawalId, notice.getTransferId());
                return marked ? "withdrawal " + withdrawalId + " pending confirmation" : "withdrawal " + withdrawalId + " unchanged";
        }
    }

    private Optional<LedgerEntry> findWithdrawal(TransferNotice notice) {
        Optional<LedgerEntry> entry = Optional.empty();
        if (notice.getWithdrawalId() != null) {
            entry = ledgerService.findEntry(notice.getWithdrawalId());
        }
        if (entry.isEmpty() && notice.getTransferId() != null) {
            entry = ledgerService.findByPayoutRef(notice.getTransferId());
        }
        return entry.filter(e -> e.getKind() == EntryKind.WITHDRAWAL);
    }
}
