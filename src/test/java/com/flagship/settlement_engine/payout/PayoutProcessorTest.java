package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.order.OrderContext;
import com.flagship.settlement_engine.payout.transfer.TransferClient;
import com.flagship.settlement_engine.payout.transfer.TransferDeclinedException;
import com.flagship.settlement_engine.payout.transfer.TransferOutcomeUnknownException;
import com.flagship.settlement_engine.payout.transfer.TransferReceipt;
import com.flagship.settlement_engine.payout.transfer.TransferRequest;
import com.flagship.settlement_engine.payout.transfer.TransferStatus;
import com.flagship.settlement_engine.payout.transfer.TransferUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Withdrawal flow decisions with the ledger and transfer API mocked.
 * The database side is covered by PayoutProcessorIntegrationTest.
 */
class PayoutProcessorTest {

    private PayoutLedgerService payoutLedger;
    private TransferClient transferClient;
    private PayoutProcessor processor;

    private final UUID beneficiaryId = UUID.randomUUID();
    private final UUID withdrawalId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        payoutLedger = mock(PayoutLedgerService.class);
        transferClient = mock(TransferClient.class);
        processor = new PayoutProcessor(payoutLedger, transferClient, new SettlementMetrics(new SimpleMeterRegistry()),
                new BigDecimal("10.00"), new BigDecimal("10000.00"), "USD");
    }

    private void reserveSucceeds(String amount) {
        LedgerEntry entry = new LedgerEntry(withdrawalId, UUID.randomUUID(), null, beneficiaryId,
                EntryKind.WITHDRAWAL, new BigDecimal(amount).negate(), EntryState.AVAILABLE, Instant.now(),
                null, null, "Withdrawal", OrderContext.empty(), 1L, Instant.now());
        when(payoutLedger.reserveWithdrawal(eq(beneficiaryId), any(BigDecimal.class))).thenReturn(Optional.of(entry));
    }

    @Test
    @DisplayName("Amounts outside the configured bounds are rejected before reserving")
    void testWithdraw_InvalidAmounts() {
        assertEquals(RejectionReason.INVALID_AMOUNT, processor.withdraw(beneficiaryId, null).getReason());
        assertEquals(RejectionReason.INVALID_AMOUNT, processor.withdraw(beneficiaryId, new BigDecimal("-5")).getReason());
        assertEquals(RejectionReason.INVALID_AMOUNT, processor.withdraw(beneficiaryId, new BigDecimal("12.345")).getReason());
        assertEquals(RejectionReason.BELOW_MINIMUM, processor.withdraw(beneficiaryId, new BigDecimal("9.99")).getReason());
        assertEquals(RejectionReason.ABOVE_MAXIMUM, processor.withdraw(beneficiaryId, new BigDecimal("10000.01")).getReason());

        verifyNoInteractions(payoutLedger, transferClient);
    }

    @Test
    @DisplayName("No reservation means insufficient funds and no transfer")
    void testWithdraw_InsufficientFunds() {
        when(payoutLedger.reserveWithdrawal(eq(beneficiaryId), any(BigDecimal.class))).thenReturn(Optional.empty());

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("50.00"));

        assertEquals(PayoutStatus.REJECTED, result.getStatus());
        assertEquals(RejectionReason.INSUFFICIENT_FUNDS, result.getReason());
        assertNull(result.getWithdrawalId());
        verifyNoInteractions(transferClient);
    }

    @Test
    @DisplayName("A paid transfer completes the withdrawal with the transfer id")
    void testWithdraw_Paid() {
        reserveSucceeds("25.00");
        when(transferClient.submit(any(TransferRequest.class)))
                .thenReturn(new TransferReceipt("tr_1", TransferStatus.PAID));

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));

        assertEquals(PayoutStatus.PAID_OUT, result.getStatus());
        assertEquals(withdrawalId, result.getWithdrawalId());
        verify(payoutLedger).completeWithdrawal(withdrawalId, "tr_1");
        verify(transferClient).submit(argThat(request ->
                request.getWithdrawalId().equals(withdrawalId)
                        && request.getAmount().compareTo(new BigDecimal("25.00")) == 0
                        && "USD".equals(request.getCurrency())));
    }

    @Test
    @DisplayName("An in-transit transfer leaves the withdrawal pending confirmation")
    void testWithdraw_InTransit() {
        reserveSucceeds("25.00");
        when(transferClient.submit(any(TransferRequest.class)))
                .thenReturn(new TransferReceipt("tr_2", TransferStatus.IN_TRANSIT));

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));

        assertEquals(PayoutStatus.PENDING, result.getStatus());
        verify(payoutLedger).markPendingConfirmation(withdrawalId, "tr_2");
        verify(payoutLedger, never()).reverseWithdrawal(any(), anyString());
    }

    @Test
    @DisplayName("Declined, unavailable and failed transfers are reversed")
    void testWithdraw_ReversedOutcomes() {
        reserveSucceeds("25.00");

        when(transferClient.submit(any(TransferRequest.class))).thenThrow(new TransferDeclinedException("no account"));
        PayoutResult declined = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));
        assertEquals(RejectionReason.TRANSFER_DECLINED, declined.getReason());
        verify(payoutLedger).reverseWithdrawal(withdrawalId, "transfer_declined");

        reset(transferClient);
        when(transferClient.submit(any(TransferRequest.class)))
                .thenThrow(new TransferUnavailableException("circuit open", null));
        PayoutResult unavailable = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));
        assertEquals(RejectionReason.TRANSFER_UNAVAILABLE, unavailable.getReason());
        verify(payoutLedger).reverseWithdrawal(withdrawalId, "transfer_unavailable");

        reset(transferClient);
        when(transferClient.submit(any(TransferRequest.class)))
                .thenReturn(new TransferReceipt("tr_3", TransferStatus.FAILED));
        PayoutResult failed = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));
        assertEquals(PayoutStatus.REJECTED, failed.getStatus());
        verify(payoutLedger).reverseWithdrawal(withdrawalId, "transfer_failed");
    }

    @Test
    @DisplayName("An unknown outcome marks the withdrawal pending confirmation and never reverses it")
    void testWithdraw_UnknownOutcome() {
        reserveSucceeds("25.00");
        when(transferClient.submit(any(TransferRequest.class)))
                .thenThrow(new TransferOutcomeUnknownException("read timed out"));

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));

        assertEquals(PayoutStatus.PENDING, result.getStatus());
        assertEquals(withdrawalId, result.getWithdrawalId());
        verify(payoutLedger).markPendingConfirmation(eq(withdrawalId), isNull());
        verify(payoutLedger, never()).reverseWithdrawal(any(), anyString());
        verify(payoutLedger, never()).completeWithdrawal(any(), anyString());
    }

    @Test
    @DisplayName("A completed transfer that cannot be recorded stays pending for the reconciler")
    void testWithdraw_RecordingFailsAfterTransfer() {
        reserveSucceeds("25.00");
        when(transferClient.submit(any(TransferRequest.class)))
                .thenReturn(new TransferReceipt("tr_4", TransferStatus.PAID));
        when(payoutLedger.completeWithdrawal(withdrawalId, "tr_4"))
                .thenThrow(new IllegalStateException("connection reset"));

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));

        assertEquals(PayoutStatus.PENDING, result.getStatus());
        verify(payoutLedger, never()).reverseWithdrawal(any(), anyString());
    }

    @Test
    @DisplayName("An unknown outcome is still reported pending when marking it fails")
    void testWithdraw_UnknownOutcomeMarkFails() {
        reserveSucceeds("25.00");
        when(transferClient.submit(any(TransferRequest.class)))
                .thenThrow(new TransferOutcomeUnknownException("connection reset"));
        when(payoutLedger.markPendingConfirmation(eq(withdrawalId), isNull()))
                .thenThrow(new IllegalStateException("database unavailable"));

        PayoutResult result = processor.withdraw(beneficiaryId, new BigDecimal("25.00"));

        assertEquals(PayoutStatus.PENDING, result.getStatus());
        verify(payoutLedger, never()).reverseWithdrawal(any(), anyString());
    }
}
