package com.flagship.settlement_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.event.SettlementEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable hand-off of settlement events to Kafka.
 *
 * {@link #append} joins the transaction that posts the ledger rows, so an
 * event exists exactly when its settlement, chargeback or payout committed.
 * The publisher side runs each step in its own transaction.
 */
@Service
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final Duration claimLease;

    public OutboxService(OutboxEventRepository repository,
                         ObjectMapper objectMapper,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                         @Value("${outbox.publisher.claim-lease:PT1M}") Duration claimLease) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries;
        this.claimLease = claimLease;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(SettlementEvent event) {
        OutboxEvent pending = OutboxEvent.create(
                event.getAggregateType(), event.getAggregateId(), event.getEventType(), toJson(event));
        OutboxEvent stored = repository.save(OutboxEventEntity.fromDomain(pending)).toDomain();
        log.debug("Outbox append {} for {} {}", event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return stored;
    }

    /**
     * Claims up to {@code limit} unpublished rows for this publisher. The
     * claim outlives the row locks, so another instance polling while these
     * are being sent skips them until they are published, fail, or the lease
     * runs out.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int limit) {
        Instant until = Instant.now().plus(claimLease);
        List<OutboxEventEntity> claimed = repository.findPublishableForUpdate(limit, maxRetries);
        claimed.forEach(entity -> entity.claimUntil(until));
        return claimed.stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(OutboxEventEntity::markPublished);
    }

    /**
     * @return true once the event has no publish attempts left
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recordFailure(UUID eventId, String errorMessage) {
        OutboxEventEntity entity = repository.findById(eventId).orElse(null);
        if (entity == null) {
            return false;
        }
        entity.recordPublishFailure(errorMessage);
        log.warn("Outbox event {} publish attempt {} of {} failed: {}",
                eventId, entity.getRetryCount(), maxRetries, errorMessage);
        return entity.getRetryCount() >= maxRetries;
    }

    /** Events of one order or withdrawal, oldest first. */
    @Transactional(readOnly = true)
    public List<OutboxEvent> history(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(SettlementEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
    }
}
