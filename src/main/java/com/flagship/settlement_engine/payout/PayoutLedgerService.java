package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.error.LedgerInconsistencyException;
import com.flagship.settlement_engine.error.NonRetryableEventException;
import com.flagship.settlement_engine.event.PayoutCompletedEvent;
import com.flagship.settlement_engine.event.PayoutReversedEvent;
import com.flagship.settlement_engine.ledger.BatchType;
import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerBatchRequest;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.ledger.PostedBatch;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger side of withdrawals. Each method is its own short transaction; none
 * of them ever wraps a call to the transfer API.
 *
 * A withdrawal is one negative WITHDRAWAL entry. While AVAILABLE or
 * PENDING_CONFIRMATION it already reduces the available balance, which is
 * what reserves the funds. A failed transfer marks it REVERSED and posts a
 * positive REVERSAL entry that gives the amount back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutLedgerService {

    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * Reserves funds for a withdrawal if the beneficiary's available balance
     * covers it. Reservations for one beneficiary are serialized on a
     * transaction-scoped advisory lock, so two concurrent requests can never
     * both see the same balance.
     *
     * @return the new withdrawal entry, or empty if funds are insufficient
     */
    @Transactional
    public Optional<LedgerEntry> reserveWithdrawal(UUID beneficiaryId, BigDecimal amount) {
        ledgerService.lockBeneficiary(beneficiaryId);

        BigDecimal available = ledgerService.getAvailableBalance(beneficiaryId);
        if (available.compareTo(amount) < 0) {
            log.info("Insufficient funds: requested={}, available={}", amount, available);
            return Optional.empty();
        }

        Instant now = Instant.now();
        PostedBatch batch = ledgerService.postBatch(new LedgerBatchRequest(
            BatchType.WITHDRAWAL,
            null,
            "Withdrawal for beneficiary " + beneficiaryId,
            null,
            List.of(LedgerBatchRequest.EntryLine.of(
                beneficiaryId, EntryKind.WITHDRAWAL, amount.negate(), EntryState.AVAILABLE, now,
                "Withdrawal of " + amount))
        ));

        LedgerEntry withdrawal = ledgerService.findEntry(batch.getEntryIds().get(0)).orElseThrow();
        log.info("Reserved withdrawal: withdrawalId={}, amount={}, availableBefore={}",
                withdrawal.getId(), amount, available);
        return Optional.of(withdrawal);
    }

    /**
     * Confirms a withdrawal as paid out. Repeat confirmations are no-ops.
     *
     * @return true if the entry moved to PAID_OUT now
     * @throws LedgerInconsistencyException if the withdrawal was already reversed
     */
    @Transactional
    public boolean completeWithdrawal(UUID withdrawalId, String payoutRef) {
        LedgerEntry withdrawal = lockWithdrawal(withdrawalId);

        switch (withdrawal.getState()) {
            case PAID_OUT:
                return false;
            case REVERSED:
                throw new LedgerInconsistencyException(String.format(
                    "Transfer %s succeeded but withdrawal %s was already reversed", payoutRef, withdrawalId));
            case AVAILABLE:
            case PENDING_CONFIRMATION:
                ledgerService.transitionState(withdrawalId, withdrawal.getState(), EntryState.PAID_OUT, payoutRef);
                outboxService.append(PayoutCompletedEvent.of(withdrawal, payoutRef));
                log.info("Withdrawal paid out: withdrawalId={}, payoutRef={}", withdrawalId, payoutRef);
                return true;
            default:
                throw new LedgerInconsistencyException(String.format(
                    "Withdrawal %s is in unexpected state %s", withdrawalId, withdrawal.getState()));
        }
    }

    /**
     * Records that a transfer was accepted but has not settled yet.
     *
     * @return true if the entry moved to PENDING_CONFIRMATION now
     */
    @Transactional
    public boolean markPendingConfirmation(UUID withdrawalId, String payoutRef) {
        LedgerEntry withdrawal = lockWithdrawal(withdrawalId);
        if (withdrawal.getState() != EntryState.AVAILABLE) {
            return false;
        }
        return ledgerService.transitionState(
            withdrawalId, EntryState.AVAILABLE, EntryState.PENDING_CONFIRMATION, payoutRef);
    }

    /**
     * Reverses a withdrawal whose transfer failed. Idempotent: a second call
     * finds the entry REVERSED and does nothing.
     *
     * @return the reversal entry id, or empty if already reversed
     */
    @Transactional
    public Optional<UUID> reverseWithdrawal(UUID withdrawalId, String reason) {
        LedgerEntry withdrawal = lockWithdrawal(withdrawalId);
        if (withdrawal.getState() == EntryState.REVERSED) {
            log.info("Withdrawal {} already reversed", withdrawalId);
            return Optional.empty();
        }

        ledgerService.transitionState(withdrawalId, withdrawal.getState(), EntryState.REVERSED, null);

        Instant now = Instant.now();
        PostedBatch batch = ledgerService.postBatch(new LedgerBatchRequest(
            BatchType.REVERSAL,
            null,
            "Reversal of withdrawal " + withdrawalId + ": " + reason,
            null,
            List.of(LedgerBatchRequest.EntryLine.reversalOf(withdrawal, now, "Reversal: " + reason))
        ));
        UUID reversalId = batch.getEntryIds().get(0);

        outboxService.append(PayoutReversedEvent.of(withdrawal, reversalId, reason));
        metrics.recordPayoutReversed(reason);
        log.warn("Withdrawal reversed: withdrawalId={}, amount={}, reason={}",
                withdrawalId, withdrawal.getAmount().abs(), reason);
        return Optional.of(reversalId);
    }

    private LedgerEntry lockWithdrawal(UUID withdrawalId) {
        LedgerEntry entry = ledgerService.lockEntry(withdrawalId)
            .orElseThrow(() -> new NonRetryableEventException("Unknown withdrawal: " + withdrawalId));
        if (entry.getKind() != EntryKind.WITHDRAWAL) {
            throw new NonRetryableEventException(
                String.format("Entry %s is a %s, not a withdrawal", withdrawalId, entry.getKind()));
        }
        return entry;
    }
}
