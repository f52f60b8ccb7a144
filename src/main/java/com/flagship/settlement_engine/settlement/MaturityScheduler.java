package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "settlement.maturity.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MaturityScheduler {

    private final MaturityTransitioner transitioner;

    @Scheduled(fixedDelayString = "${settlement.maturity.interval-ms:60000}")
    public void run() {
        CorrelationContext.openBackground();
        try {
            transitioner.sweep();
        } catch (Exception e) {
            log.error("Maturity sweep failed: {}", e.getMessage(), e);
        } finally {
            CorrelationContext.close();
        }
    }
}
