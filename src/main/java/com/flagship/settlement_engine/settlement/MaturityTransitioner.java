package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Releases HELD shares whose hold has elapsed. A single UPDATE, so it is
 * safe to run from several instances at once and to re-run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaturityTransitioner {

    private final LedgerService ledgerService;
    private final SettlementMetrics metrics;

    public int sweep() {
        long startTime = System.currentTimeMillis();
        int matured = ledgerService.matureHeldEntries();
        metrics.recordMatured(matured);
        metrics.recordLatency("maturity_sweep", System.currentTimeMillis() - startTime);
        if (matured > 0) {
            log.info("Matured {} held entries", matured);
        }
        return matured;
    }
}
