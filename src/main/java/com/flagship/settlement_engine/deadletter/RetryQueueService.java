package com.flagship.settlement_engine.deadletter;

import com.flagship.settlement_engine.error.ErrorClassifier;
import com.flagship.settlement_engine.intake.ProcessorEvent;
import com.flagship.settlement_engine.observability.DeadLetterMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable queue for events that failed with a transient error after their
 * in-line retries. Entries are picked up by {@link RetryQueueWorker}.
 */
@Service
@Slf4j
public class RetryQueueService {

    private static final Duration MAX_BACKOFF = Duration.ofHours(6);

    private final RetryQueueRepository retryQueueRepository;
    private final FailedEventRepository failedEventRepository;
    private final ErrorClassifier errorClassifier;
    private final DeadLetterMetrics metrics;
    private final Duration initialBackoff;

    public RetryQueueService(RetryQueueRepository retryQueueRepository,
                             FailedEventRepository failedEventRepository,
                             ErrorClassifier errorClassifier,
                             DeadLetterMetrics metrics,
                             @Value("${settlement.retry-queue.initial-backoff:PT30S}") Duration initialBackoff) {
        this.retryQueueRepository = retryQueueRepository;
        this.failedEventRepository = failedEventRepository;
        this.errorClassifier = errorClassifier;
        this.metrics = metrics;
        this.initialBackoff = initialBackoff;
    }

    /**
     * Queues an event for a later attempt. An event already queued stays as it is.
     */
    public void enqueue(ProcessorEvent event, Throwable error) {
        boolean inserted = retryQueueRepository.enqueue(
            event.getEventId(),
            event.getEventTypeName(),
            event.getRawPayload(),
            event.bestEffortOrderId(),
            Instant.now().plus(initialBackoff),
            errorClassifier.describe(error) + ": " + error.getMessage()
        );
        if (inserted) {
            metrics.recordRetryQueued(event.getEventTypeName());
            log.warn("Event {} ({}) queued for retry: {}", event.getEventId(), event.getEventTypeName(), error.getMessage());
        } else {
            log.info("Event {} already in the retry queue", event.getEventId());
        }
    }

    /**
     * Delay before attempt {@code attempts + 1}: doubles from the initial
     * backoff, capped at six hours.
     */
    public Duration backoffAfter(int attempts) {
        Duration delay = initialBackoff.multipliedBy(1L << Math.min(attempts, 20));
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    /**
     * Moves an exhausted entry to the dead-letter log, atomically.
     */
    @Transactional
    public void moveToDeadLetter(RetryQueueEntry entry, int attempts, Throwable error) {
        String errorClass = errorClassifier.describe(error);
        failedEventRepository.save(FailedEventEntity.capture(
            entry.getExternalEventId(),
            entry.getEventType(),
            entry.getRawPayload(),
            entry.getOrderId(),
            error.getMessage(),
            errorClass,
            attempts
        ));
        retryQueueRepository.delete(entry.getId());

        metrics.recordDeadLettered(entry.getEventType(), errorClass);
        log.error("Event {} ({}) dead-lettered after {} attempts: {}",
                entry.getExternalEventId(), entry.getEventType(), attempts, error.getMessage());
    }
}
