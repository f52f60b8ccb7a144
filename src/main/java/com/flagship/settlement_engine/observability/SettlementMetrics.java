package com.flagship.settlement_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for settlement, maturity, payouts and event intake.
 *
 * - settlement.orders{outcome}: settle calls by outcome
 * - settlement.latency{operation}: duration of settle / withdraw / intake
 * - settlement.entries.matured: entries moved from HELD to AVAILABLE
 * - payout.requests{status,reason}: withdrawal results
 * - payout.reversals{reason}: compensated withdrawals
 * - intake.events{event_type,outcome}: processor events by outcome
 * - intake.duplicates{source}: redeliveries caught by Redis or the database
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final Counter maturedEntries;
    private final Counter chargebacks;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.maturedEntries = Counter.builder("settlement.entries.matured")
                .description("Ledger entries moved from HELD to AVAILABLE")
                .register(registry);

        this.chargebacks = Counter.builder("settlement.chargebacks")
                .description("Chargebacks applied to settled orders")
                .register(registry);
    }

    public void recordSettlement(String outcome) {
        registry.counter("settlement.orders", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("settlement.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordMatured(int count) {
        if (count > 0) {
            maturedEntries.increment(count);
        }
    }

    public void recordChargeback() {
        chargebacks.increment();
    }

    public void recordPayout(String status, String reason) {
        registry.counter("payout.requests",
                "status", sanitizeTag(status),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordPayoutReversed(String reason) {
        registry.counter("payout.reversals", "reason", sanitizeTag(reason)).increment();
    }

    public void recordIntake(String eventType, String outcome) {
        registry.counter("intake.events",
                "event_type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDuplicate(String source) {
        registry.counter("intake.duplicates", "source", sanitizeTag(source)).increment();
    }

    /**
     * Keeps tag values short and free of punctuation to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "none";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
