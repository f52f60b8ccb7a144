package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.deadletter.FailedEventRepository;
import com.flagship.settlement_engine.deadletter.RetryQueueRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Dead-letter log and retry queue metrics. Alert on the unresolved gauge:
 * every unresolved row is money the ledger has not accounted for yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterMetrics {

    private final FailedEventRepository failedEventRepository;
    private final RetryQueueRepository retryQueueRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong unresolvedCount = new AtomicLong(0);
    private final AtomicLong retryQueueDepth = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("intake.failed_events.unresolved", unresolvedCount, AtomicLong::get)
                .description("Dead-lettered events not yet resolved")
                .register(meterRegistry);

        Gauge.builder("intake.retry_queue.depth", retryQueueDepth, AtomicLong::get)
                .description("Events waiting in the retry queue")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            unresolvedCount.set(failedEventRepository.countByResolvedAtIsNull());
            retryQueueDepth.set(retryQueueRepository.countPending());
        } catch (Exception e) {
            log.warn("Failed to refresh dead-letter metrics: {}", e.getMessage());
        }
    }

    public long getUnresolvedCount() {
        return unresolvedCount.get();
    }

    public void recordDeadLettered(String eventType, String errorClass) {
        meterRegistry.counter("intake.events.dead_lettered",
                "event_type", eventType,
                "error_class", errorClass
        ).increment();
    }

    public void recordRetryQueued(String eventType) {
        meterRegistry.counter("intake.events.retry_queued", "event_type", eventType).increment();
    }

    public void recordReprocessed(String source, String outcome) {
        meterRegistry.counter("intake.events.reprocessed",
                "source", source,
                "outcome", outcome
        ).increment();
    }
}
