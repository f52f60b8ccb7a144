package com.flagship.settlement_engine.deadletter;

import com.flagship.settlement_engine.error.ErrorClassifier;
import com.flagship.settlement_engine.intake.EventPipeline;
import com.flagship.settlement_engine.intake.IntakeOutcome;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.DeadLetterMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Drains the retry queue. Each due entry gets one attempt per pass; a
 * retryable failure is rescheduled with backoff until the attempt limit,
 * anything else goes to the dead-letter log.
 */
@Component
@ConditionalOnProperty(name = "settlement.retry-queue.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RetryQueueWorker {

    private final RetryQueueRepository repository;
    private final RetryQueueService retryQueueService;
    private final EventPipeline pipeline;
    private final ErrorClassifier errorClassifier;
    private final DeadLetterMetrics metrics;
    private final String workerId = "retry-worker-" + UUID.randomUUID().toString().substring(0, 8);

    @Value("${settlement.retry-queue.batch-size:20}")
    private int batchSize;

    @Value("${settlement.retry-queue.lease:PT2M}")
    private Duration lease;

    @Value("${settlement.retry-queue.max-attempts:8}")
    private int maxAttempts;

    public RetryQueueWorker(RetryQueueRepository repository,
                            RetryQueueService retryQueueService,
                            EventPipeline pipeline,
                            ErrorClassifier errorClassifier,
                            DeadLetterMetrics metrics) {
        this.repository = repository;
        this.retryQueueService = retryQueueService;
        this.pipeline = pipeline;
        this.errorClassifier = errorClassifier;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${settlement.retry-queue.poll-interval-ms:5000}")
    public void run() {
        CorrelationContext.openBackground();
        try {
            processDue();
        } catch (Exception e) {
            log.error("Retry queue pass failed: {}", e.getMessage(), e);
        } finally {
            CorrelationContext.close();
        }
    }

    /**
     * @return number of entries attempted
     */
    public int processDue() {
        List<RetryQueueEntry> due = repository.claimDue(workerId, lease, batchSize);
        for (RetryQueueEntry entry : due) {
            attempt(entry);
        }
        return due.size();
    }

    private void attempt(RetryQueueEntry entry) {
        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, String.valueOf(entry.getExternalEventId()));
        int attempts = entry.getAttempts() + 1;
        try {
            IntakeOutcome outcome = pipeline.apply(entry.getRawPayload());
            repository.delete(entry.getId());
            metrics.recordReprocessed("retry_queue", outcome.name());
            log.info("Queued event {} applied on attempt {}: {}", entry.getExternalEventId(), attempts, outcome);
        } catch (Exception e) {
            if (errorClassifier.isRetryable(e) && attempts < maxAttempts) {
                Instant next = Instant.now().plus(retryQueueService.backoffAfter(attempts));
                repository.reschedule(entry.getId(), attempts, next, errorClassifier.describe(e) + ": " + e.getMessage());
                log.warn("Queued event {} failed attempt {}, next at {}: {}",
                        entry.getExternalEventId(), attempts, next, e.getMessage());
            } else {
                retryQueueService.moveToDeadLetter(entry, attempts, e);
            }
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
        }
    }
}
