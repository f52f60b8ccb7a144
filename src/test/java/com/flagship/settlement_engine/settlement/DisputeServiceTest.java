package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.error.OrderNotFoundException;
import com.flagship.settlement_engine.error.TransientEventException;
import com.flagship.settlement_engine.ledger.BalanceView;
import com.flagship.settlement_engine.ledger.EntryKind;
import com.flagship.settlement_engine.ledger.EntryState;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderContext;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payout.PayoutLedgerService;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chargebacks freeze an order's unpaid earnings.
 */
@SpringBootTest
@Testcontainers
class DisputeServiceTest {

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
        registry.add("settlement.maturity.enabled", () -> "false");
        registry.add("settlement.retry-queue.enabled", () -> "false");
        registry.add("settlement.payout.reconciler.enabled", () -> "false");
    }

    @Autowired
    private DisputeService disputeService;

    @Autowired
    private SettlementEngine settlementEngine;

    @Autowired
    private MaturityTransitioner maturityTransitioner;

    @Autowired
    private OrderService orderService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PayoutLedgerService payoutLedger;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(Exception e) {
        System.out.println("✓ EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private Order registerOrder(Instant fulfillmentEnd) {
        return orderService.registerOrder(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                null, UUID.randomUUID(), new BigDecimal("200.00"), fulfillmentEnd, OrderContext.empty());
    }

    @Test
    @DisplayName("A chargeback disputes held earnings and removes them from lifetime totals")
    void testOpenChargeback_DisputesHeldEntries() {
        printTestHeader("Chargeback on held earnings");
        Order order = registerOrder(Instant.now().plus(Duration.ofDays(1)));
        settlementEngine.settle(order.getId(), "pi_" + order.getId());

        int disputed = disputeService.openChargeback(order.getId(), null, "dp_1");

        // platform fee, facilitator commission and fulfiller share
        assertEquals(3, disputed);
        List<LedgerEntry> entries = ledgerService.getEntriesForOrder(order.getId());
        assertTrue(entries.stream()
                .filter(e -> e.getKind() != EntryKind.PAYMENT)
                .allMatch(e -> e.getState() == EntryState.DISPUTED));

        BalanceView fulfiller = ledgerService.getBalance(order.getFulfillerId());
        assertEquals(0, fulfiller.getHeld().signum());
        assertEquals(0, fulfiller.getAvailable().signum());
        assertEquals(0, fulfiller.getLifetimeTotal().signum());

        assertTrue(outboxService.history("Order", order.getId()).stream()
                .anyMatch(e -> e.getEventType().equals("ChargebackRecorded")));
        printSuccess(disputed + " entries disputed");
    }

    @Test
    @DisplayName("A disputed entry is not matured by a later sweep")
    void testOpenChargeback_DisputedEntriesDoNotMature() {
        Order order = registerOrder(Instant.now().minus(Duration.ofDays(10)));
        settlementEngine.settle(order.getId(), "pi_" + order.getId());
        disputeService.openChargeback(order.getId(), null, "dp_2");

        maturityTransitioner.sweep();

        assertEquals(0, ledgerService.getAvailableBalance(order.getFulfillerId()).signum());
    }

    @Test
    @DisplayName("A chargeback can be matched by payment reference")
    void testOpenChargeback_ByPaymentRef() {
        Order order = registerOrder(Instant.now());
        settlementEngine.settle(order.getId(), "pi_ref_" + order.getId());

        int disputed = disputeService.openChargeback(null, "pi_ref_" + order.getId(), "dp_3");

        assertTrue(disputed > 0);
    }

    @Test
    @DisplayName("A chargeback before settlement is transient and changes nothing")
    void testOpenChargeback_BeforeSettlement() {
        printTestHeader("Chargeback ahead of payment");
        Order order = registerOrder(Instant.now());

        TransientEventException e = assertThrows(TransientEventException.class,
                () -> disputeService.openChargeback(order.getId(), null, "dp_4"));
        printExpectedException(e);

        assertTrue(ledgerService.getEntriesForOrder(order.getId()).isEmpty());
    }

    @Test
    @DisplayName("A chargeback for an unknown payment is refused")
    void testOpenChargeback_UnknownPaymentRef() {
        assertThrows(OrderNotFoundException.class,
                () -> disputeService.openChargeback(null, "pi_nobody", "dp_5"));
        assertThrows(IllegalArgumentException.class,
                () -> disputeService.openChargeback(null, null, "dp_6"));
    }

    @Test
    @DisplayName("Earnings already withdrawn stay paid out and the balance never goes negative")
    void testOpenChargeback_AfterWithdrawal() {
        printTestHeader("Chargeback after the fulfiller withdrew");
        Order order = registerOrder(Instant.now().minus(Duration.ofDays(10)));
        settlementEngine.settle(order.getId(), "pi_" + order.getId());
        maturityTransitioner.sweep();

        // 200.00 gross: fulfiller 140.00, facilitator 40.00, platform 20.00
        UUID fulfillerId = order.getFulfillerId();
        assertEquals(0, new BigDecimal("140.00").compareTo(ledgerService.getAvailableBalance(fulfillerId)));
        LedgerEntry withdrawal = payoutLedger.reserveWithdrawal(fulfillerId, new BigDecimal("140.00")).orElseThrow();
        payoutLedger.completeWithdrawal(withdrawal.getId(), "tr_" + withdrawal.getId());

        int disputed = disputeService.openChargeback(order.getId(), null, "dp_7");

        // platform fee and facilitator commission only
        assertEquals(2, disputed);
        List<LedgerEntry> entries = ledgerService.getEntriesForOrder(order.getId());
        LedgerEntry fulfillerShare = entries.stream()
                .filter(e -> e.getKind() == EntryKind.FULFILLER_PAYOUT)
                .findFirst().orElseThrow();
        assertEquals(EntryState.AVAILABLE, fulfillerShare.getState());
        assertTrue(entries.stream()
                .filter(e -> e.getKind() == EntryKind.FACILITATOR_COMMISSION || e.getKind() == EntryKind.PLATFORM_FEE)
                .allMatch(e -> e.getState() == EntryState.DISPUTED));

        assertEquals(0, ledgerService.getAvailableBalance(fulfillerId).signum());
        assertEquals(0, ledgerService.getAvailableBalance(order.getFacilitatorId()).signum());
        assertEquals(EntryState.PAID_OUT, ledgerService.findEntry(withdrawal.getId()).orElseThrow().getState());
        printSuccess("fulfiller share kept as paid out, " + disputed + " entries disputed");
    }
}
