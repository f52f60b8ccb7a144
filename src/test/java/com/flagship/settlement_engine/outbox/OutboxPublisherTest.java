package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.order.Order;
import com.flagship.settlement_engine.order.OrderContext;
import com.flagship.settlement_engine.order.OrderService;
import com.flagship.settlement_engine.settlement.SettlementEngine;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka.
 *
 * These tests verify that:
 * - Settlement events committed with the ledger reach the topic
 * - Published events are marked and not sent again
 * - Records are keyed by aggregate id
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean present, polls triggered manually
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("settlement.intake.dedup.redis-enabled", () -> "false");
        registry.add("settlement.maturity.enabled", () -> "false");
        registry.add("settlement.retry-queue.enabled", () -> "false");
        registry.add("settlement.payout.reconciler.enabled", () -> "false");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private SettlementEngine settlementEngine;

    @Autowired
    private OrderService orderService;

    @Value("${settlement.kafka.topic:settlement-events}")
    private String settlementTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(settlementTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ConsumerRecord<String, String>> pollFor(String key, Duration timeout) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (matching.isEmpty() && System.currentTimeMillis() < deadline) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
            for (ConsumerRecord<String, String> record : records) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }

    @Test
    @DisplayName("A settled order's event is published keyed by order id and marked published")
    void testPublisher_PublishesSettlementEvent() {
        printTestHeader("Publish OrderSettled");
        Order order = orderService.registerOrder(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), null, new BigDecimal("100.00"), Instant.now(), OrderContext.empty());
        settlementEngine.settle(order.getId(), "pi_" + order.getId());
        assertEquals(1, outboxService.countUnpublished());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollFor(order.getId().toString(), Duration.ofSeconds(20));
        assertEquals(1, records.size());
        String payload = records.get(0).value();
        System.out.println("Received: " + payload);
        assertTrue(payload.contains(order.getId().toString()));
        assertTrue(payload.contains("OrderSettled"));

        List<OutboxEvent> events = outboxService.history("Order", order.getId());
        assertEquals(1, events.size());
        assertTrue(events.get(0).isPublished());
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Event delivered and marked published");
    }

    @Test
    @DisplayName("A second poll does not send published events again")
    void testPublisher_DoesNotRepublish() {
        Order order = orderService.registerOrder(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                null, null, new BigDecimal("20.00"), Instant.now(), OrderContext.empty());
        settlementEngine.settle(order.getId(), "pi_" + order.getId());

        outboxPublisher.publishPendingEvents();
        assertEquals(1, pollFor(order.getId().toString(), Duration.ofSeconds(20)).size());

        outboxPublisher.publishPendingEvents();
        assertTrue(pollFor(order.getId().toString(), Duration.ofSeconds(3)).isEmpty());
    }

    @Test
    @DisplayName("A claimed event is invisible to a second publisher until it is released")
    void testClaimBatch_SecondPublisherSkipsClaimedRows() {
        Order order = orderService.registerOrder(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                null, null, new BigDecimal("20.00"), Instant.now(), OrderContext.empty());
        settlementEngine.settle(order.getId(), "pi_" + order.getId());

        List<OutboxEvent> first = outboxService.claimBatch(10);
        assertEquals(1, first.size());

        // another instance polling while the first is still sending
        assertTrue(outboxService.claimBatch(10).isEmpty());

        outboxService.recordFailure(first.get(0).getId(), "broker unavailable");
        List<OutboxEvent> retried = outboxService.claimBatch(10);
        assertEquals(1, retried.size());
        assertEquals(1, retried.get(0).getRetryCount());

        outboxService.markPublished(retried.get(0).getId());
        assertTrue(outboxService.claimBatch(10).isEmpty());
        assertEquals(0, outboxService.countUnpublished());
    }
}
