package com.flagship.settlement_engine.intake;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies processor events at most once.
 *
 * The processed marker is claimed first, inside the same transaction as the
 * handler's ledger writes. If the handler throws, the claim rolls back with
 * everything else and the event can be tried again. If it commits, every
 * later delivery of the same event id is a no-op.
 *
 * The transaction is bounded so a slow database cannot hold a webhook
 * request open past the processor's timeout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @param handler the processing logic; returns a short description stored
     *                with the processed marker
     * @return PROCESSED if the handler ran, DUPLICATE if the event was
     *         already applied
     */
    @Transactional(timeoutString = "${settlement.intake.transaction-timeout-seconds:5}")
    public IntakeOutcome process(ProcessorEvent event, Supplier<String> handler) {
        ProcessedEvent marker = ProcessedEvent.success(event.getEventId(), event.getEventTypeName());
        if (!claim(marker)) {
            log.info("Event {} ({}) already processed, skipping", event.getEventId(), event.getEventTypeName());
            return IntakeOutcome.DUPLICATE;
        }

        String detail = handler.get();
        if (detail != null) {
            repository.updateDetail(event.getEventId(), detail);
        }

        log.debug("Processed event {} ({}): {}", event.getEventId(), event.getEventTypeName(), detail);
        return IntakeOutcome.PROCESSED;
    }

    /**
     * Records an event we do not act on so redeliveries short-circuit.
     */
    @Transactional(timeoutString = "${settlement.intake.transaction-timeout-seconds:5}")
    public IntakeOutcome skip(ProcessorEvent event, String reason) {
        if (!claim(ProcessedEvent.skipped(event.getEventId(), event.getEventTypeName(), reason))) {
            return IntakeOutcome.DUPLICATE;
        }
        log.debug("Skipped event {} ({}): {}", event.getEventId(), event.getEventTypeName(), reason);
        return IntakeOutcome.SKIPPED;
    }

    public boolean isAlreadyProcessed(String eventId) {
        return repository.existsById(eventId);
    }

    @Transactional(readOnly = true)
    public Optional<ProcessedEvent> findProcessed(String eventId) {
        return repository.findById(eventId).map(ProcessedEventEntity::toDomain);
    }

    private boolean claim(ProcessedEvent marker) {
        return repository.claim(
            marker.getEventId(),
            marker.getEventType(),
            marker.getProcessedAt(),
            marker.getResult().name(),
            marker.getDetail()
        ) == 1;
    }
}
