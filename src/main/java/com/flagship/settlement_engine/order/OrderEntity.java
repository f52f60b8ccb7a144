package com.flagship.settlement_engine.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for orders.
 *
 * No setters: parties, amount and fulfillment end are fixed at registration;
 * only the payment state moves, through {@link #updateFromDomain(Order)}.
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_orders_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private UUID payerId;

    @Column(name = "fulfiller_id", nullable = false, updatable = false)
    private UUID fulfillerId;

    @Column(name = "referrer_id", updatable = false)
    private UUID referrerId;

    @Column(name = "facilitator_id", updatable = false)
    private UUID facilitatorId;

    @Column(name = "gross_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal grossAmount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OrderStatus status;

    @Column(name = "external_payment_ref", unique = true)
    private String externalPaymentRef;

    @Column(name = "fulfillment_end_time", nullable = false, updatable = false)
    private Instant fulfillmentEndTime;

    @Column(name = "service_name", updatable = false)
    private String serviceName;

    @Column(name = "subject", updatable = false)
    private String subject;

    @Column(name = "payer_name", updatable = false)
    private String payerName;

    @Column(name = "fulfiller_name", updatable = false)
    private String fulfillerName;

    @Column(name = "facilitator_name", updatable = false)
    private String facilitatorName;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static OrderEntity fromDomain(Order order) {
        OrderContext context = order.getContext();
        return new OrderEntity(
            order.getId(),
            order.getPayerId(),
            order.getFulfillerId(),
            order.getReferrerId(),
            order.getFacilitatorId(),
            order.getGrossAmount(),
            order.getCurrency(),
            order.getStatus(),
            order.getExternalPaymentRef(),
            order.getFulfillmentEndTime(),
            context.getServiceName(),
            context.getSubject(),
            context.getPayerName(),
            context.getFulfillerName(),
            context.getFacilitatorName(),
            order.getFailureReason(),
            order.getPaidAt(),
            null, // createdAt, set by @PrePersist
            null  // updatedAt, set by @PrePersist
        );
    }

    public Order toDomain() {
        return new Order(
            id,
            payerId,
            fulfillerId,
            referrerId,
            facilitatorId,
            grossAmount.setScale(2, RoundingMode.HALF_UP),
            currency,
            status,
            externalPaymentRef,
            fulfillmentEndTime,
            new OrderContext(serviceName, subject, payerName, fulfillerName, facilitatorName),
            failureReason,
            paidAt
        );
    }

    /**
     * Copies the payment state from the domain object. The payment reference
     * can be stamped once and never replaced.
     */
    void updateFromDomain(Order order) {
        if (this.externalPaymentRef != null && !this.externalPaymentRef.equals(order.getExternalPaymentRef())) {
            throw new IllegalStateException(
                "Payment reference already set for order " + this.id + ". Cannot settle order twice.");
        }
        this.status = order.getStatus();
        this.externalPaymentRef = order.getExternalPaymentRef();
        this.failureReason = order.getFailureReason();
        this.paidAt = order.getPaidAt();
    }
}
