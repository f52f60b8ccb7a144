package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.deadletter.FailedEventRepository;
import com.flagship.settlement_engine.deadletter.RetryQueueRepository;
import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Actuator indicators for the settlement pipeline. Only the outbox can report
 * DOWN; the others degrade, because the engine keeps settling without them.
 */
public class HealthIndicators {

    static final Status WARNING = new Status("WARNING");
    static final Status DEGRADED = new Status("DEGRADED");

    private HealthIndicators() {
    }

    static Health failed(Status status, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return Health.status(status).withDetail("error", message).build();
    }

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warnAt;
        private final long downAt;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.warn-backlog:1000}") long warnAt,
                                     @Value("${outbox.health.down-backlog:10000}") long downAt) {
            this.outboxRepository = outboxRepository;
            this.warnAt = warnAt;
            this.downAt = downAt;
        }

        @Override
        public Health health() {
            long pending;
            try {
                pending = outboxRepository.countUnpublished();
            } catch (Exception e) {
                return failed(Status.DOWN, e);
            }
            Status status = pending >= downAt ? Status.DOWN : pending >= warnAt ? WARNING : Status.UP;
            return Health.status(status)
                    .withDetail("pending", pending)
                    .withDetail("warnAt", warnAt)
                    .withDetail("downAt", downAt)
                    .build();
        }
    }

    /**
     * Any unresolved dead-lettered event is money the ledger has not
     * accounted for, so it raises WARNING until an operator replays it.
     */
    @Component("deadLetterHealth")
    public static class DeadLetterHealthIndicator implements HealthIndicator {

        private final FailedEventRepository failedEventRepository;
        private final RetryQueueRepository retryQueueRepository;

        public DeadLetterHealthIndicator(FailedEventRepository failedEventRepository,
                                         RetryQueueRepository retryQueueRepository) {
            this.failedEventRepository = failedEventRepository;
            this.retryQueueRepository = retryQueueRepository;
        }

        @Override
        public Health health() {
            try {
                long unresolved = failedEventRepository.countByResolvedAtIsNull();
                return Health.status(unresolved > 0 ? WARNING : Status.UP)
                        .withDetail("unresolved", unresolved)
                        .withDetail("queuedForRetry", retryQueueRepository.countPending())
                        .build();
            } catch (Exception e) {
                return failed(WARNING, e);
            }
        }
    }

    /** Payouts are refused with transfer_unavailable while the breaker is open. */
    @Component("transferApiHealth")
    public static class TransferApiHealthIndicator implements HealthIndicator {

        private final CircuitBreaker breaker;

        public TransferApiHealthIndicator(@Qualifier("transferCircuitBreaker") CircuitBreaker breaker) {
            this.breaker = breaker;
        }

        @Override
        public Health health() {
            CircuitBreaker.State state = breaker.getState();
            boolean passing = state == CircuitBreaker.State.CLOSED || state == CircuitBreaker.State.HALF_OPEN;
            CircuitBreaker.Metrics metrics = breaker.getMetrics();
            return Health.status(passing ? Status.UP : DEGRADED)
                    .withDetail("circuit", state.name())
                    .withDetail("failureRate", metrics.getFailureRate())
                    .withDetail("notPermittedCalls", metrics.getNumberOfNotPermittedCalls())
                    .build();
        }
    }

    /** Redis is only the duplicate-delivery fast path; the database claim still holds. */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return Health.status(DEGRADED).withDetail("error", "no connection factory").build();
            }
            try (RedisConnection connection = factory.getConnection()) {
                String reply = connection.ping();
                return Health.status("PONG".equals(reply) ? Status.UP : DEGRADED)
                        .withDetail("ping", String.valueOf(reply))
                        .build();
            } catch (Exception e) {
                return failed(DEGRADED, e);
            }
        }
    }

    /** A producer with no metrics has never connected to a broker. */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final Supplier<Integer> producerMetricCount;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.producerMetricCount = () -> kafkaTemplate.metrics().size();
        }

        @Override
        public Health health() {
            try {
                int count = producerMetricCount.get();
                return Health.status(count > 0 ? Status.UP : DEGRADED)
                        .withDetail("producerMetrics", count)
                        .build();
            } catch (Exception e) {
                return failed(DEGRADED, e);
            }
        }
    }
}
