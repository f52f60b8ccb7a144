package com.flagship.settlement_engine.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Gauges backed by table counts are refreshed here on one timer instead of
 * on every Prometheus scrape.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final DeadLetterMetrics deadLetterMetrics;

    @Scheduled(initialDelayString = "${metrics.refresh.initial-delay:5000}",
            fixedDelayString = "${metrics.refresh.interval:15000}")
    public void refreshBacklogGauges() {
        deadLetterMetrics.refreshMetrics();
        outboxMetrics.refreshMetrics();
    }
}
