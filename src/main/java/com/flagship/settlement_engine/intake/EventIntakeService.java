package com.flagship.settlement_engine.intake;

import com.flagship.settlement_engine.deadletter.DeadLetterService;
import com.flagship.settlement_engine.deadletter.RetryQueueService;
import com.flagship.settlement_engine.error.ErrorClassifier;
import com.flagship.settlement_engine.error.IntakeDeadlineExceededException;
import com.flagship.settlement_engine.error.MalformedEventException;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Entry point for verified processor events.
 *
 * Every event ends in exactly one place:
 * - applied (or recognised as a duplicate, or skipped as unhandled)
 * - the retry queue, after transient failures used up the in-line retries
 * - the dead-letter log, for anything that cannot succeed by retrying
 *
 * Only when none of those can be written does the error escape, and the
 * processor is asked to redeliver.
 */
@Service
@Slf4j
public class EventIntakeService {

    private static final String UNKNOWN_EVENT_TYPE = "unknown";

    private final ProcessorEventParser parser;
    private final EventPipeline pipeline;
    private final EventDeduplicationCache deduplicationCache;
    private final DeadLetterService deadLetterService;
    private final RetryQueueService retryQueueService;
    private final ErrorClassifier errorClassifier;
    private final Retry eventIntakeRetry;
    private final SettlementMetrics metrics;
    private final Duration deadline;

    public EventIntakeService(ProcessorEventParser parser,
                              EventPipeline pipeline,
                              EventDeduplicationCache deduplicationCache,
                              DeadLetterService deadLetterService,
                              RetryQueueService retryQueueService,
                              ErrorClassifier errorClassifier,
                              Retry eventIntakeRetry,
                              SettlementMetrics metrics,
                              @Value("${settlement.intake.deadline:PT10S}") Duration deadline) {
        this.parser = parser;
        this.pipeline = pipeline;
        this.deduplicationCache = deduplicationCache;
        this.deadLetterService = deadLetterService;
        this.retryQueueService = retryQueueService;
        this.errorClassifier = errorClassifier;
        this.eventIntakeRetry = eventIntakeRetry;
        this.metrics = metrics;
        this.deadline = deadline;
    }

    /**
     * @throws EventCaptureException if the event failed and could not be
     *         queued or dead-lettered either
     */
    public IntakeOutcome receive(String rawPayload) {
        long startTime = System.currentTimeMillis();

        ProcessorEvent event;
        try {
            event = parser.parse(rawPayload);
        } catch (MalformedEventException e) {
            captureDeadLetter(null, UNKNOWN_EVENT_TYPE, rawPayload, null, e, 1);
            return finish(UNKNOWN_EVENT_TYPE, IntakeOutcome.DEAD_LETTERED, startTime);
        }

        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, event.getEventId());
        try {
            if (deduplicationCache.isKnownDuplicate(event.getEventId())) {
                metrics.recordDuplicate("cache");
                return finish(event.getEventTypeName(), IntakeOutcome.DUPLICATE, startTime);
            }

            IntakeOutcome outcome = applyWithRetry(event);
            deduplicationCache.remember(event.getEventId());
            if (outcome == IntakeOutcome.DUPLICATE) {
                metrics.recordDuplicate("database");
            }
            return finish(event.getEventTypeName(), outcome, startTime);

        } catch (Exception e) {
            return finish(event.getEventTypeName(), handleFailure(event, e), startTime);
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
        }
    }

    private IntakeOutcome applyWithRetry(ProcessorEvent event) {
        Instant deadlineAt = Instant.now().plus(deadline);
        return eventIntakeRetry.executeSupplier(() -> {
            if (Instant.now().isAfter(deadlineAt)) {
                throw new IntakeDeadlineExceededException(event.getEventId(), deadline);
            }
            return pipeline.apply(event);
        });
    }

    private IntakeOutcome handleFailure(ProcessorEvent event, Exception error) {
        boolean retryable = errorClassifier.isRetryable(error);
        if (retryable) {
            try {
                retryQueueService.enqueue(event, error);
                return IntakeOutcome.QUEUED_FOR_RETRY;
            } catch (Exception queueError) {
                log.error("Could not queue event {} for retry: {}", event.getEventId(), queueError.getMessage());
                error.addSuppressed(queueError);
            }
        }
        captureDeadLetter(event.getEventId(), event.getEventTypeName(), event.getRawPayload(),
                event, error, retryable ? eventIntakeRetry.getRetryConfig().getMaxAttempts() : 1);
        return IntakeOutcome.DEAD_LETTERED;
    }

    private void captureDeadLetter(String eventId, String eventType, String rawPayload,
                                   ProcessorEvent event, Exception error, int attempts) {
        try {
            deadLetterService.capture(eventId, eventType, rawPayload,
                    event != null ? event.bestEffortOrderId() : null, error, attempts);
        } catch (Exception captureError) {
            captureError.addSuppressed(error);
            throw new EventCaptureException("Failed to record failed event " + eventId, captureError);
        }
    }

    private IntakeOutcome finish(String eventType, IntakeOutcome outcome, long startTime) {
        // the sender chooses the type string; only known types become tag values
        String typeTag = ProcessorEventType.fromWireName(eventType)
                .map(ProcessorEventType::getWireName)
                .orElse(UNKNOWN_EVENT_TYPE);
        metrics.recordIntake(typeTag, outcome.name());
        metrics.recordLatency("intake", System.currentTimeMillis() - startTime);
        log.info("Event intake finished: type={}, outcome={}", eventType, outcome);
        return outcome;
    }
}
