package com.flagship.settlement_engine.intake;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, String> {

    /**
     * Inserts the processed marker unless one exists.
     *
     * A concurrent delivery of the same event blocks on the primary key
     * until the first transaction ends, then sees 0 rows inserted.
     *
     * @return 1 if this caller claimed the event, 0 if it was already claimed
     */
    @Modifying
    @Query(value = """
        INSERT INTO processed_events (event_id, event_type, processed_at, processing_result, detail)
        VALUES (:eventId, :eventType, :processedAt, :result, :detail)
        ON CONFLICT (event_id) DO NOTHING
        """, nativeQuery = true)
    int claim(@Param("eventId") String eventId,
              @Param("eventType") String eventType,
              @Param("processedAt") Instant processedAt,
              @Param("result") String result,
              @Param("detail") String detail);

    @Modifying
    @Query("UPDATE ProcessedEventEntity e SET e.detail = :detail WHERE e.eventId = :eventId")
    int updateDetail(@Param("eventId") String eventId, @Param("detail") String detail);
}
