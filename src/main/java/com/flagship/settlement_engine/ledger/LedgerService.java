package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.order.OrderContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Writes and reads the append-only ledger.
 *
 * Invariants enforced here and again in the database:
 * 1. Settlement batches sum to exactly zero (deferred constraint trigger)
 * 2. Debit kinds carry negative amounts, credit kinds positive (check constraint)
 * 3. Rows are never deleted and their amounts never change (append-only trigger)
 *
 * Plain JDBC: the ledger is written in bulk and its correctness lives in SQL.
 * Runs inside the caller's JPA transaction when there is one.
 */
@Service
public class LedgerService {

    private static final String ENTRY_COLUMNS =
        "id, batch_id, order_id, beneficiary_id, kind, amount, state, available_at, external_payout_ref, " +
        "related_entry_id, description, service_name, subject, payer_name, fulfiller_name, facilitator_name, " +
        "sequence_number, created_at";

    private static final String CLEARED_STATES = "('AVAILABLE', 'PAID_OUT', 'PENDING_CONFIRMATION', 'REVERSED')";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Posts a batch of entries.
     *
     * @return the batch id and the ids of the entries, in request order
     * @throws IllegalArgumentException if a settlement batch is not balanced,
     *         or an entry's sign or beneficiary does not fit its kind
     */
    @Transactional
    public PostedBatch postBatch(LedgerBatchRequest request) {
        if (request.getEntries() == null || request.getEntries().isEmpty()) {
            throw new IllegalArgumentException("Batch has no entries");
        }
        if (request.getBatchType() == BatchType.SETTLEMENT && !request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Settlement batch is not balanced: total=%s", request.getTotal()));
        }
        for (LedgerBatchRequest.EntryLine line : request.getEntries()) {
            validateLine(line);
        }

        UUID batchId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_batches (id, batch_type, order_id, description, created_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            batchId,
            request.getBatchType().name(),
            request.getOrderId(),
            request.getDescription()
        );

        OrderContext context = request.getContext() != null ? request.getContext() : OrderContext.empty();
        List<UUID> entryIds = new ArrayList<>(request.getEntries().size());
        for (LedgerBatchRequest.EntryLine line : request.getEntries()) {
            entryIds.add(insertEntry(batchId, request.getOrderId(), line, context));
        }

        // Balance is checked again by the deferred trigger at commit
        return new PostedBatch(batchId, List.copyOf(entryIds));
    }

    private void validateLine(LedgerBatchRequest.EntryLine line) {
        if (line.getAmount() == null || line.getAmount().signum() == 0) {
            throw new IllegalArgumentException("Entry amount must be non-zero: kind=" + line.getKind());
        }
        boolean negative = line.getAmount().signum() < 0;
        if (negative != line.getKind().isDebit()) {
            throw new IllegalArgumentException(
                String.format("Entry of kind %s cannot have amount %s", line.getKind(), line.getAmount()));
        }
        if ((line.getKind() == EntryKind.PLATFORM_FEE) != (line.getBeneficiaryId() == null)) {
            throw new IllegalArgumentException("Only platform fee entries have no beneficiary");
        }
    }

    private UUID insertEntry(UUID batchId, UUID orderId, LedgerBatchRequest.EntryLine line, OrderContext context) {
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, batch_id, order_id, beneficiary_id, kind, amount, state, available_at, " +
            "related_entry_id, description, service_name, subject, payer_name, fulfiller_name, facilitator_name, " +
            "created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            entryId,
            batchId,
            orderId,
            line.getBeneficiaryId(),
            line.getKind().name(),
            line.getAmount(),
            line.getState().name(),
            Timestamp.from(line.getAvailableAt()),
            line.getRelatedEntryId(),
            line.getDescription(),
            context.getServiceName(),
            context.getSubject(),
            context.getPayerName(),
            context.getFulfillerName(),
            context.getFacilitatorName()
        );
        return entryId;
    }

    public List<LedgerEntry> getEntriesForOrder(UUID orderId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE order_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            orderId
        );
    }

    public List<LedgerEntry> getEntriesForBatch(UUID batchId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE batch_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            batchId
        );
    }

    public List<LedgerEntry> getEntriesForBeneficiary(UUID beneficiaryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE beneficiary_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            beneficiaryId
        );
    }

    public Optional<LedgerEntry> findEntry(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ?",
            ledgerEntryRowMapper(),
            entryId
        ).stream().findFirst();
    }

    public Optional<LedgerEntry> findByPayoutRef(String externalPayoutRef) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE external_payout_ref = ?",
            ledgerEntryRowMapper(),
            externalPayoutRef
        ).stream().findFirst();
    }

    /**
     * Reads an entry with a row lock held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LedgerEntry> lockEntry(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ? FOR UPDATE",
            ledgerEntryRowMapper(),
            entryId
        ).stream().findFirst();
    }

    /**
     * Number of entries in the settlement batch of an order; zero if the
     * order was never settled.
     */
    public int countSettlementEntries(UUID orderId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries e JOIN ledger_batches b ON b.id = e.batch_id " +
            "WHERE b.order_id = ? AND b.batch_type = 'SETTLEMENT'",
            Integer.class,
            orderId
        );
        return count != null ? count : 0;
    }

    /**
     * Compare-and-set state change of one entry.
     *
     * @param payoutRef stamped when not null; an existing reference is kept
     * @return true if the entry was in the expected state and moved
     */
    @Transactional
    public boolean transitionState(UUID entryId, EntryState expected, EntryState next, String payoutRef) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Ledger entry cannot move from %s to %s", expected, next));
        }
        int updated = jdbcTemplate.update(
            "UPDATE ledger_entries SET state = ?, external_payout_ref = COALESCE(external_payout_ref, ?) " +
            "WHERE id = ? AND state = ?",
            next.name(),
            payoutRef,
            entryId,
            expected.name()
        );
        return updated == 1;
    }

    /**
     * Moves every held entry whose hold period has ended to AVAILABLE.
     * One statement, so a concurrent run either sees a row as HELD or not at all.
     *
     * @return number of entries matured
     */
    @Transactional
    public int matureHeldEntries() {
        return jdbcTemplate.update(
            "UPDATE ledger_entries SET state = 'AVAILABLE' WHERE state = 'HELD' AND available_at <= now()"
        );
    }

    /**
     * Freezes the earnings of an order that have not been paid out.
     *
     * HELD entries and the platform fee can never have been withdrawn and are
     * always disputed. An AVAILABLE earning counts as paid out once the
     * beneficiary's withdrawals have used it: it is disputed only while the
     * beneficiary's available balance still covers it, otherwise it stays
     * AVAILABLE. Beneficiaries are locked in id order so a concurrent
     * withdrawal cannot spend the same balance. The payment debit is never
     * touched.
     */
    @Transactional
    public DisputeTally disputeOrderEntries(UUID orderId) {
        List<LedgerEntry> open = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE order_id = ? AND kind <> 'PAYMENT' AND state IN ('HELD', 'AVAILABLE') " +
            "ORDER BY sequence_number FOR UPDATE",
            ledgerEntryRowMapper(),
            orderId
        );

        Map<UUID, BigDecimal> remaining = new TreeMap<>();
        for (LedgerEntry entry : open) {
            if (entry.getState() == EntryState.AVAILABLE && entry.getBeneficiaryId() != null) {
                remaining.putIfAbsent(entry.getBeneficiaryId(), null);
            }
        }
        for (UUID beneficiaryId : remaining.keySet()) {
            lockBeneficiary(beneficiaryId);
            remaining.put(beneficiaryId, getAvailableBalance(beneficiaryId));
        }

        int disputed = 0;
        int paidOut = 0;
        for (LedgerEntry entry : open) {
            BigDecimal balance = entry.getBeneficiaryId() != null ? remaining.get(entry.getBeneficiaryId()) : null;
            if (entry.getState() == EntryState.AVAILABLE && balance != null) {
                BigDecimal after = balance.subtract(entry.getAmount());
                if (after.signum() < 0) {
                    paidOut++;
                    continue;
                }
                remaining.put(entry.getBeneficiaryId(), after);
            }
            transitionState(entry.getId(), entry.getState(), EntryState.DISPUTED, null);
            disputed++;
        }
        return new DisputeTally(disputed, paidOut);
    }

    /**
     * Serializes balance-changing work for one beneficiary until the current
     * transaction ends.
     */
    public void lockBeneficiary(UUID beneficiaryId) {
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (SELECT pg_advisory_xact_lock(hashtextextended(?, 0))) AS beneficiary_lock",
            Integer.class,
            beneficiaryId.toString()
        );
    }

    /**
     * Withdrawals whose transfer outcome is still open and that were created
     * before the given instant.
     */
    public List<LedgerEntry> findOpenWithdrawals(Instant createdBefore, int limit) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE kind = 'WITHDRAWAL' AND state IN ('AVAILABLE', 'PENDING_CONFIRMATION') AND created_at < ? " +
            "ORDER BY created_at LIMIT ?",
            ledgerEntryRowMapper(),
            Timestamp.from(createdBefore),
            limit
        );
    }

    /**
     * Withdrawable balance of a beneficiary. Payment debits are excluded: a
     * party paying for one order does not lose what it earned on another.
     */
    public BigDecimal getAvailableBalance(UUID beneficiaryId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries " +
            "WHERE beneficiary_id = ? AND kind <> 'PAYMENT' AND state IN " + CLEARED_STATES,
            BigDecimal.class,
            beneficiaryId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    public BalanceView getBalance(UUID beneficiaryId) {
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "  COALESCE(SUM(CASE WHEN kind <> 'PAYMENT' AND state IN " + CLEARED_STATES + " THEN amount END), 0) AS available, " +
            "  COALESCE(SUM(CASE WHEN state = 'HELD' THEN amount END), 0) AS held, " +
            "  COALESCE(SUM(CASE WHEN kind IN ('FULFILLER_PAYOUT', 'REFERRAL_COMMISSION', 'FACILITATOR_COMMISSION') " +
            "                     AND state <> 'DISPUTED' THEN amount END), 0) AS lifetime_total " +
            "FROM ledger_entries WHERE beneficiary_id = ?",
            (rs, rowNum) -> new BalanceView(
                beneficiaryId,
                rs.getBigDecimal("available"),
                rs.getBigDecimal("held"),
                rs.getBigDecimal("lifetime_total")
            ),
            beneficiaryId
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("batch_id")),
            uuidOrNull(rs, "order_id"),
            uuidOrNull(rs, "beneficiary_id"),
            EntryKind.valueOf(rs.getString("kind")),
            rs.getBigDecimal("amount"),
            EntryState.valueOf(rs.getString("state")),
            instantOrNull(rs, "available_at"),
            rs.getString("external_payout_ref"),
            uuidOrNull(rs, "related_entry_id"),
            rs.getString("description"),
            new OrderContext(
                rs.getString("service_name"),
                rs.getString("subject"),
                rs.getString("payer_name"),
                rs.getString("fulfiller_name"),
                rs.getString("facilitator_name")),
            rs.getLong("sequence_number"),
            instantOrNull(rs, "created_at")
        );
    }

    private static UUID uuidOrNull(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value != null ? value.toInstant() : null;
    }
}
