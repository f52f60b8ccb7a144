package com.flagship.settlement_engine.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    /**
     * Loads the order with {@code SELECT ... FOR UPDATE}. Callers set the
     * lock timeout for the surrounding transaction first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<OrderEntity> findByExternalPaymentRef(String externalPaymentRef);

    /**
     * Cheap pre-lock idempotency check. Returns a scalar so nothing is put in
     * the persistence context ahead of the locking read.
     */
    @Query("""
        SELECT CASE WHEN COUNT(o) > 0 THEN true ELSE false END FROM OrderEntity o
        WHERE o.id = :id AND o.status = com.flagship.settlement_engine.order.OrderStatus.PAID
        AND o.externalPaymentRef = :paymentRef
        """)
    boolean isSettledBy(@Param("id") UUID id, @Param("paymentRef") String paymentRef);
}
