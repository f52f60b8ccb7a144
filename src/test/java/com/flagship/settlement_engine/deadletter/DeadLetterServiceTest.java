package com.flagship.settlement_engine.deadletter;

import com.flagship.settlement_engine.intake.EventIntakeService;
import com.flagship.settlement_engine.intake.IntakeOutcome;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.order.OrderContext;
import com.flagship.settlement_engine.order.OrderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failed events are never lost: dead-lettered events can be replayed once
 * the missing data arrives, and transient failures wait in the retry queue.
 */
@SpringBootTest
@Testcontainers
class DeadLetterServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("settlement.intake.dedup.redis-enabled", () -> "false");
        registry.add("settlement.intake.initial-backoff-ms", () -> "10");
        registry.add("settlement.maturity.enabled", () -> "false");
        registry.add("settlement.payout.reconciler.enabled", () -> "false");
        // Worker bean present, passes driven by the tests
        registry.add("settlement.retry-queue.enabled", () -> "true");
        registry.add("settlement.retry-queue.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private EventIntakeService intakeService;

    @Autowired
    private DeadLetterService deadLetterService;

    @Autowired
    private RetryQueueWorker retryQueueWorker;

    @Autowired
    private RetryQueueRepository retryQueueRepository;

    @Autowired
    private FailedEventRepository failedEventRepository;

    @Autowired
    private OrderService orderService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static String paymentSucceeded(String eventId, UUID orderId) {
        return String.format("{\"event_id\":\"%s\",\"event_type\":\"payment.succeeded\","
                + "\"payload\":{\"order_id\":\"%s\",\"payment_ref\":\"pi_%s\"}}", eventId, orderId, orderId);
    }

    private void registerOrder(UUID orderId) {
        orderService.registerOrder(orderId, UUID.randomUUID(), UUID.randomUUID(), null, null,
                new BigDecimal("60.00"), Instant.now(), OrderContext.empty());
    }

    private FailedEvent onlyFailedEvent(String eventId) {
        List<FailedEventEntity> found = failedEventRepository.findByExternalEventId(eventId);
        assertEquals(1, found.size());
        return found.get(0).toDomain();
    }

    @Test
    @DisplayName("A payment that arrived before its order is resolved by replay once the order exists")
    void testRetry_ResolvesAfterOrderRegistered() {
        printTestHeader("Replay dead-lettered payment");
        UUID orderId = UUID.randomUUID();
        String eventId = "evt_" + UUID.randomUUID();

        assertEquals(IntakeOutcome.DEAD_LETTERED, intakeService.receive(paymentSucceeded(eventId, orderId)));
        FailedEvent failed = onlyFailedEvent(eventId);
        assertFalse(failed.isResolved());
        assertEquals("OrderNotFoundException", failed.getErrorClass());
        assertTrue(deadLetterService.listUnresolved(500).stream().anyMatch(e -> e.getId().equals(failed.getId())));

        ReprocessResult tooEarly = deadLetterService.retry(failed.getId()).orElseThrow();
        printOutput("Replay before order", tooEarly);
        assertEquals(ReprocessResult.Status.FAILED, tooEarly.getStatus());
        assertEquals(2, deadLetterService.find(failed.getId()).orElseThrow().getAttempts());

        registerOrder(orderId);
        ReprocessResult resolved = deadLetterService.retry(failed.getId()).orElseThrow();
        printOutput("Replay after order", resolved);

        assertEquals(ReprocessResult.Status.RESOLVED, resolved.getStatus());
        assertEquals(3, ledgerService.getEntriesForOrder(orderId).size());
        FailedEvent after = deadLetterService.find(failed.getId()).orElseThrow();
        assertTrue(after.isResolved());
        assertNotNull(after.getResolutionNotes());

        ReprocessResult again = deadLetterService.retry(failed.getId()).orElseThrow();
        assertEquals(ReprocessResult.Status.ALREADY_RESOLVED, again.getStatus());
        assertEquals(3, ledgerService.getEntriesForOrder(orderId).size());
        printSuccess("Settled from the dead-letter log exactly once");
    }

    @Test
    @DisplayName("Replaying an unknown failed event id finds nothing")
    void testRetry_UnknownId() {
        assertTrue(deadLetterService.retry(UUID.randomUUID()).isEmpty());
    }

    @Test
    @DisplayName("A chargeback ahead of its payment waits in the retry queue and applies later")
    void testRetryQueue_ChargebackAppliesAfterPayment() {
        printTestHeader("Chargeback before payment");
        UUID orderId = UUID.randomUUID();
        registerOrder(orderId);
        String chargebackEventId = "evt_" + UUID.randomUUID();
        String chargeback = String.format("{\"event_id\":\"%s\",\"event_type\":\"chargeback.opened\","
                + "\"payload\":{\"order_id\":\"%s\",\"chargeback_id\":\"dp_%s\"}}", chargebackEventId, orderId, orderId);

        IntakeOutcome queued = intakeService.receive(chargeback);
        printOutput("Chargeback outcome", queued);
        assertEquals(IntakeOutcome.QUEUED_FOR_RETRY, queued);
        assertTrue(failedEventRepository.findByExternalEventId(chargebackEventId).isEmpty());
        assertTrue(retryQueueRepository.countPending() >= 1);

        assertEquals(IntakeOutcome.PROCESSED,
                intakeService.receive(paymentSucceeded("evt_" + UUID.randomUUID(), orderId)));

        jdbcTemplate.update("UPDATE event_retry_queue SET next_attempt_at = now() WHERE external_event_id = ?",
                chargebackEventId);
        int attempted = retryQueueWorker.processDue();
        printOutput("Queue entries attempted", attempted);

        assertTrue(attempted >= 1);
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM event_retry_queue WHERE external_event_id = ?", Integer.class, chargebackEventId));
        assertTrue(ledgerService.getEntriesForOrder(orderId).stream()
                .filter(e -> e.getState() == EntryState.DISPUTED)
                .count() >= 2);
        printSuccess("Chargeback applied from the retry queue");
    }

    @Test
    @DisplayName("A queued event that turns out to be non-retryable moves to the dead-letter log")
    void testRetryQueue_NonRetryableMovesToDeadLetter() {
        UUID orderId = UUID.randomUUID();
        String eventId = "evt_" + UUID.randomUUID();
        String raw = paymentSucceeded(eventId, orderId);
        retryQueueRepository.enqueue(eventId, "payment.succeeded", raw, orderId, Instant.now(), "manual");

        retryQueueWorker.processDue();

        FailedEvent failed = onlyFailedEvent(eventId);
        assertEquals(raw, failed.getRawPayload());
        assertEquals(orderId, failed.getOrderId());
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM event_retry_queue WHERE external_event_id = ?", Integer.class, eventId));
    }
}
