package com.flagship.settlement_engine.deadletter;

import com.flagship.settlement_engine.error.ErrorClassifier;
import com.flagship.settlement_engine.intake.EventPipeline;
import com.flagship.settlement_engine.intake.IntakeOutcome;
import com.flagship.settlement_engine.observability.DeadLetterMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The dead-letter log: capture, inspection and replay of events that could
 * not be applied.
 *
 * Capture runs in its own transaction so it commits even when the caller's
 * work rolled back. Replays go through the normal pipeline, so an event that
 * was applied in the meantime comes back as a duplicate and is simply marked
 * resolved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterService {

    private final FailedEventRepository repository;
    private final EventPipeline pipeline;
    private final ErrorClassifier errorClassifier;
    private final DeadLetterMetrics metrics;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FailedEvent capture(String externalEventId, String eventType, String rawPayload,
                               UUID orderId, Throwable error, int attempts) {
        String errorClass = errorClassifier.describe(error);
        FailedEventEntity saved = repository.save(FailedEventEntity.capture(
            externalEventId, eventType, rawPayload, orderId, error.getMessage(), errorClass, attempts));

        metrics.recordDeadLettered(eventType, errorClass);
        log.error("Event dead-lettered: failedEventId={}, eventId={}, type={}, orderId={}, error={}: {}",
                saved.getId(), externalEventId, eventType, orderId, errorClass, error.getMessage());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<FailedEvent> listUnresolved(int limit) {
        return repository.findByResolvedAtIsNullOrderByCreatedAtAsc(PageRequest.of(0, limit)).stream()
            .map(FailedEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<FailedEvent> find(UUID id) {
        return repository.findById(id).map(FailedEventEntity::toDomain);
    }

    /**
     * Replays one dead-lettered event. A resolved event is left alone.
     *
     * @return empty if no such failed event exists
     */
    public Optional<ReprocessResult> retry(UUID id) {
        Optional<FailedEventEntity> found = repository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        FailedEventEntity entity = found.get();
        if (entity.isResolved()) {
            return Optional.of(ReprocessResult.alreadyResolved(id));
        }

        ReprocessResult result;
        try {
            IntakeOutcome outcome = pipeline.apply(entity.getRawPayload());
            entity.markResolved("Reprocessed: " + outcome.name().toLowerCase());
            result = ReprocessResult.resolved(id, outcome.name());
            log.info("Failed event {} resolved by replay: outcome={}", id, outcome);
        } catch (Exception e) {
            entity.recordFailedAttempt(e.getMessage(), errorClassifier.describe(e));
            result = ReprocessResult.failed(id, e.getMessage());
            log.warn("Replay of failed event {} failed again (attempt {}): {}", id, entity.getAttempts(), e.getMessage());
        }

        repository.save(entity);
        metrics.recordReprocessed("dead_letter", result.getStatus().name());
        return Optional.of(result);
    }

    /**
     * Replays the oldest unresolved events, one at a time.
     */
    public List<ReprocessResult> retryUnresolved(int limit) {
        List<ReprocessResult> results = new ArrayList<>();
        for (FailedEvent failed : listUnresolved(limit)) {
            retry(failed.getId()).ifPresent(results::add);
        }
        return results;
    }
}
