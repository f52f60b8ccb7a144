package com.flagship.settlement_engine.config;

import com.flagship.settlement_engine.error.ErrorClassifier;
import com.flagship.settlement_engine.error.IntakeDeadlineExceededException;
import com.flagship.settlement_engine.payout.transfer.TransferDeclinedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j circuit breaker around the external transfer API and bounded
 * retry for inbound processor events.
 */
@Configuration
public class Resilience4jConfig {

    public static final String TRANSFER_CIRCUIT_BREAKER = "transfer-api";
    public static final String EVENT_INTAKE_RETRY = "event-intake";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig defaults = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slowCallRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(2))
                .permittedNumberOfCallsInHalfOpenState(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(100)
                .minimumNumberOfCalls(10)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
        return CircuitBreakerRegistry.of(defaults);
    }

    /**
     * Breaker for the transfer API. A declined transfer is a business answer,
     * not an outage, so it does not count towards the failure rate.
     */
    @Bean
    public CircuitBreaker transferCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig transferConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(40)
                .slowCallRateThreshold(40)
                .slowCallDurationThreshold(Duration.ofSeconds(5))
                .permittedNumberOfCallsInHalfOpenState(5)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(5)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreExceptions(TransferDeclinedException.class)
                .build();
        return registry.circuitBreaker(TRANSFER_CIRCUIT_BREAKER, transferConfig);
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * In-line retry for a single inbound event. Only errors the classifier
     * calls retryable are retried; the per-event deadline is never retried.
     */
    @Bean
    public Retry eventIntakeRetry(RetryRegistry registry,
                                  ErrorClassifier errorClassifier,
                                  @Value("${settlement.intake.max-attempts:3}") int maxAttempts,
                                  @Value("${settlement.intake.initial-backoff-ms:200}") long initialBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, 2.0))
                .retryOnException(error -> !(error instanceof IntakeDeadlineExceededException)
                        && errorClassifier.isRetryable(error))
                .build();
        return registry.retry(EVENT_INTAKE_RETRY, config);
    }
}
