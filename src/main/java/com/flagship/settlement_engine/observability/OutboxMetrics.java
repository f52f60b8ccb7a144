package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishing health of the settlement event outbox. A growing backlog means
 * downstream notification of settlements and payouts is falling behind.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private static final String PUBLISH_ATTEMPTS = "settlement.outbox.publish";

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;
    private final Clock clock = Clock.systemUTC();

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    void registerGauges() {
        Gauge.builder("settlement.outbox.pending", pending, AtomicLong::get)
                .description("Settlement events written but not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("settlement.outbox.oldest_pending.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("How long the oldest pending settlement event has waited")
                .register(meterRegistry);
        Gauge.builder("settlement.outbox.exhausted", exhausted, AtomicLong::get)
                .description("Pending events past the publish retry limit")
                .register(meterRegistry);
    }

    /** Called by {@link MetricsScheduler}; scrapes only read the cached values. */
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            exhausted.set(outboxRepository.countStuck(maxRetries));
            Instant now = clock.instant();
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(createdAt -> Math.max(0L, Duration.between(createdAt, now).toSeconds()))
                    .orElse(0L));
        } catch (Exception e) {
            log.warn("Outbox gauge refresh skipped: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        publishCounter(eventType, "published");
    }

    public void recordEventPublishFailed(String eventType) {
        publishCounter(eventType, "failed");
    }

    public void recordEventDeadLettered(String eventType) {
        publishCounter(eventType, "gave_up");
    }

    private void publishCounter(String eventType, String outcome) {
        meterRegistry.counter(PUBLISH_ATTEMPTS, "event_type", eventType, "outcome", outcome).increment();
    }
}
