package com.flagship.settlement_engine.deadletter;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FailedEventRepository extends JpaRepository<FailedEventEntity, UUID> {

    List<FailedEventEntity> findByResolvedAtIsNullOrderByCreatedAtAsc(Pageable pageable);

    List<FailedEventEntity> findByExternalEventId(String externalEventId);

    List<FailedEventEntity> findByOrderId(UUID orderId);

    long countByResolvedAtIsNull();
}
