package com.flagship.settlement_engine.order;

import com.flagship.settlement_engine.error.OrderNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence and state changes for orders.
 *
 * Registration happens in the booking flow; everything else here is driven
 * by processor events.
 */
@Service
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final JdbcTemplate jdbcTemplate;
    private final String currency;
    private final Duration lockTimeout;

    public OrderService(OrderRepository orderRepository,
                        JdbcTemplate jdbcTemplate,
                        @Value("${settlement.currency:USD}") String currency,
                        @Value("${settlement.lock-timeout:5s}") Duration lockTimeout) {
        this.orderRepository = orderRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.currency = currency;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Registers a new unpaid order.
     *
     * @throws IllegalArgumentException if the order is invalid or the id is taken
     */
    @Transactional
    public Order registerOrder(UUID orderId, UUID payerId, UUID fulfillerId, UUID referrerId,
                               UUID facilitatorId, BigDecimal grossAmount, Instant fulfillmentEndTime,
                               OrderContext context) {
        UUID id = orderId != null ? orderId : UUID.randomUUID();
        if (orderRepository.existsById(id)) {
            throw new IllegalArgumentException("Order already exists: " + id);
        }
        Order order = Order.register(id, payerId, fulfillerId, referrerId, facilitatorId,
                grossAmount, currency, fulfillmentEndTime, context);
        OrderEntity saved = orderRepository.save(OrderEntity.fromDomain(order));
        log.info("Registered order: orderId={}, grossAmount={}, referrer={}, facilitator={}",
                id, grossAmount, referrerId != null, facilitatorId != null);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Order> findOrder(UUID orderId) {
        return orderRepository.findById(orderId).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByPaymentRef(String paymentRef) {
        return orderRepository.findByExternalPaymentRef(paymentRef).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean isSettledBy(UUID orderId, String paymentRef) {
        return orderRepository.isSettledBy(orderId, paymentRef);
    }

    /**
     * Locks the order row for the rest of the caller's transaction.
     * Waits at most the configured lock timeout; a timeout surfaces as a
     * transient data access exception.
     *
     * @throws OrderNotFoundException if the order does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderEntity lockOrder(UUID orderId) {
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeout.toMillis() + "ms'");
        return orderRepository.findByIdForUpdate(orderId)
            .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * Writes a state transition of a locked order and flushes, so constraint
     * violations surface inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order applyTransition(OrderEntity entity, Order updated) {
        entity.updateFromDomain(updated);
        return orderRepository.saveAndFlush(entity).toDomain();
    }

    /**
     * Records a failed payment attempt. A paid order is left untouched.
     *
     * @return true if the order changed
     */
    @Transactional
    public boolean recordPaymentFailure(UUID orderId, String reason) {
        OrderEntity entity = lockOrder(orderId);
        Order order = entity.toDomain();
        if (order.getStatus() == OrderStatus.PAID) {
            log.info("Ignoring payment failure for paid order: orderId={}", orderId);
            return false;
        }
        applyTransition(entity, order.markPaymentFailed(reason));
        log.info("Recorded payment failure: orderId={}, reason={}", orderId, reason);
        return true;
    }
}
