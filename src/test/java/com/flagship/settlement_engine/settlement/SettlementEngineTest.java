package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.error.LedgerInconsistencyException;
import com.flagship.settlement_engine.error.OrderNotFoundException;
import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderContext;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.order.OrderStatus;
import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement of paid orders into the ledger.
 *
 * These tests verify that:
 * - A settlement batch sums to zero and credits every party once
 * - Earnings are held until the hold period after fulfillment ends
 * - Redelivered payments do not post a second time, even concurrently
 * - Unknown orders and conflicting payments are refused
 */
@SpringBootTest
@Testcontainers
class SettlementEngineTest {

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
        // No broker or Redis in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("settlement.intake.dedup.redis-enabled", () -> "false");
        registry.add("settlement.maturity.enabled", () -> "false");
        registry.add("settlement.retry-queue.enabled", () -> "false");
        registry.add("settlement.payout.reconciler.enabled", () -> "false");
    }

    @Autowired
    private SettlementEngine settlementEngine;

    @Autowired
    private OrderService orderService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(Exception e) {
        System.out.println("✓ EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private Order registerOrder(String gross, UUID referrer, UUID facilitator, Instant fulfillmentEnd) {
        return orderService.registerOrder(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                referrer, facilitator, new BigDecimal(gross), fulfillmentEnd,
                new OrderContext("Consultation", "Tax review", "Pat Payer", "Fran Fulfiller", "Fay Facilitator"));
    }

    private static BigDecimal sum(List<LedgerEntry> entries) {
        return entries.stream().map(LedgerEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static LedgerEntry entryOfKind(List<LedgerEntry> entries, EntryKind kind) {
        return entries.stream().filter(e -> e.getKind() == kind).findFirst()
                .orElseThrow(() -> new AssertionError("No entry of kind " + kind));
    }

    @Test
    @DisplayName("Settling a paid order posts a zero-sum batch crediting every party")
    void testSettle_PostsBalancedBatch() {
        printTestHeader("Settle order with referrer and facilitator");

        UUID referrer = UUID.randomUUID();
        UUID facilitator = UUID.randomUUID();
        Instant fulfillmentEnd = Instant.now().plus(Duration.ofDays(2));
        Order order = registerOrder("100.00", referrer, facilitator, fulfillmentEnd);
        printInput("Order", order.getId() + " gross=100.00");

        SettlementResult result = settlementEngine.settle(order.getId(), "pi_" + order.getId());
        printOutput("Result", result.describe());

        assertTrue(result.isNewlySettled());
        List<LedgerEntry> entries = ledgerService.getEntriesForOrder(order.getId());
        assertEquals(5, entries.size());
        assertEquals(0, sum(entries).signum());

        LedgerEntry payment = entryOfKind(entries, EntryKind.PAYMENT);
        assertEquals(order.getPayerId(), payment.getBeneficiaryId());
        assertEquals(0, new BigDecimal("-100.00").compareTo(payment.getAmount()));

        LedgerEntry fee = entryOfKind(entries, EntryKind.PLATFORM_FEE);
        assertNull(fee.getBeneficiaryId());
        assertEquals(EntryState.AVAILABLE, fee.getState());
        assertEquals(0, new BigDecimal("10.00").compareTo(fee.getAmount()));

        LedgerEntry fulfillerShare = entryOfKind(entries, EntryKind.FULFILLER_PAYOUT);
        assertEquals(order.getFulfillerId(), fulfillerShare.getBeneficiaryId());
        assertEquals(EntryState.HELD, fulfillerShare.getState());
        assertEquals(0, new BigDecimal("60.00").compareTo(fulfillerShare.getAmount()));
        assertEquals(fulfillmentEnd.plus(Duration.ofDays(7)).getEpochSecond(),
                fulfillerShare.getAvailableAt().getEpochSecond());
        assertEquals("Consultation", fulfillerShare.getContext().getServiceName());

        assertEquals(0, new BigDecimal("10.00").compareTo(entryOfKind(entries, EntryKind.REFERRAL_COMMISSION).getAmount()));
        assertEquals(0, new BigDecimal("20.00").compareTo(entryOfKind(entries, EntryKind.FACILITATOR_COMMISSION).getAmount()));

        Order paid = orderService.findOrder(order.getId()).orElseThrow();
        assertEquals(OrderStatus.PAID, paid.getStatus());
        assertEquals("pi_" + order.getId(), paid.getExternalPaymentRef());

        assertEquals(0, new BigDecimal("60.00").compareTo(ledgerService.getBalance(order.getFulfillerId()).getHeld()));
        assertEquals(0, ledgerService.getAvailableBalance(order.getFulfillerId()).signum());
        assertFalse(outboxEventRepository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                "Order", order.getId()).isEmpty());

        printSuccess("Batch of 5 entries sums to zero");
    }

    @Test
    @DisplayName("A redelivered payment settles once")
    void testSettle_Idempotent() {
        printTestHeader("Redelivered payment");
        Order order = registerOrder("80.00", null, null, Instant.now());
        String ref = "pi_" + order.getId();

        SettlementResult first = settlementEngine.settle(order.getId(), ref);
        SettlementResult second = settlementEngine.settle(order.getId(), ref);
        printOutput("First", first.describe());
        printOutput("Second", second.describe());

        assertEquals(SettlementResult.Outcome.SETTLED, first.getOutcome());
        assertEquals(SettlementResult.Outcome.ALREADY_SETTLED, second.getOutcome());
        assertEquals(3, ledgerService.getEntriesForOrder(order.getId()).size());
        assertEquals(3, ledgerService.countSettlementEntries(order.getId()));
        printSuccess("Second delivery posted nothing");
    }

    @Test
    @DisplayName("Concurrent deliveries of the same payment post exactly one batch")
    void testSettle_ConcurrentDeliveries() throws InterruptedException {
        printTestHeader("Concurrent settlement");
        Order order = registerOrder("120.00", UUID.randomUUID(), null, Instant.now());
        String ref = "pi_" + order.getId();

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger settled = new AtomicInteger();
        AtomicInteger alreadySettled = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    SettlementResult result = settlementEngine.settle(order.getId(), ref);
                    if (result.isNewlySettled()) {
                        settled.incrementAndGet();
                    } else {
                        alreadySettled.incrementAndGet();
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                    System.out.println("Unexpected failure: " + e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Settled", settled.get());
        printOutput("Already settled", alreadySettled.get());

        assertEquals(1, settled.get());
        assertEquals(threads - 1, alreadySettled.get());
        assertEquals(0, failures.get());
        List<LedgerEntry> entries = ledgerService.getEntriesForOrder(order.getId());
        assertEquals(4, entries.size());
        assertEquals(0, sum(entries).signum());
        printSuccess("One batch from " + threads + " deliveries");
    }

    @Test
    @DisplayName("A payment for an unknown order is refused and nothing is posted")
    void testSettle_UnknownOrder() {
        printTestHeader("Unknown order");
        UUID unknown = UUID.randomUUID();

        OrderNotFoundException e = assertThrows(OrderNotFoundException.class,
                () -> settlementEngine.settle(unknown, "pi_missing"));
        printExpectedException(e);

        assertTrue(ledgerService.getEntriesForOrder(unknown).isEmpty());
    }

    @Test
    @DisplayName("A second, different payment for a paid order is an inconsistency")
    void testSettle_DifferentPaymentRef() {
        printTestHeader("Conflicting payment");
        Order order = registerOrder("50.00", null, null, Instant.now());
        settlementEngine.settle(order.getId(), "pi_first_" + order.getId());

        LedgerInconsistencyException e = assertThrows(LedgerInconsistencyException.class,
                () -> settlementEngine.settle(order.getId(), "pi_second_" + order.getId()));
        printExpectedException(e);

        assertEquals(3, ledgerService.getEntriesForOrder(order.getId()).size());
        assertEquals("pi_first_" + order.getId(),
                orderService.findOrder(order.getId()).orElseThrow().getExternalPaymentRef());
    }

    @Test
    @DisplayName("An order whose payment failed earlier can still be settled")
    void testSettle_AfterPaymentFailure() {
        Order order = registerOrder("40.00", null, null, Instant.now());
        assertTrue(orderService.recordPaymentFailure(order.getId(), "card_declined"));
        assertEquals(OrderStatus.PAYMENT_FAILED, orderService.findOrder(order.getId()).orElseThrow().getStatus());

        SettlementResult result = settlementEngine.settle(order.getId(), "pi_retry_" + order.getId());

        assertTrue(result.isNewlySettled());
        assertEquals(OrderStatus.PAID, orderService.findOrder(order.getId()).orElseThrow().getStatus());
        assertFalse(orderService.recordPaymentFailure(order.getId(), "late_failure"));
    }
}
