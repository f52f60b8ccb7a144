package com.flagship.settlement_engine.attribution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Commission percentages in basis points (1 bp = 0.01%). The fulfiller always
 * receives whatever the other shares leave over.
 */
@Component
@Getter
@Slf4j
public class CommissionPolicy {

    public static final int FULL_AMOUNT_BPS = 10_000;

    private final int platformBps;
    private final int referralBps;
    private final int facilitatorBps;

    public CommissionPolicy(@Value("${settlement.commission.platform-bps:1000}") int platformBps,
                            @Value("${settlement.commission.referral-bps:1000}") int referralBps,
                            @Value("${settlement.commission.facilitator-bps:2000}") int facilitatorBps) {
        if (platformBps < 0 || referralBps < 0 || facilitatorBps < 0) {
            throw new IllegalArgumentException("Commission shares cannot be negative");
        }
        if (platformBps + referralBps + facilitatorBps >= FULL_AMOUNT_BPS) {
            throw new IllegalArgumentException(String.format(
                "Commission shares leave nothing for the fulfiller: platform=%d, referral=%d, facilitator=%d",
                platformBps, referralBps, facilitatorBps));
        }
        this.platformBps = platformBps;
        this.referralBps = referralBps;
        this.facilitatorBps = facilitatorBps;
        log.info("Commission policy: platform={}bp, referral={}bp, facilitator={}bp",
                platformBps, referralBps, facilitatorBps);
    }

    public static CommissionPolicy standard() {
        return new CommissionPolicy(1000, 1000, 2000);
    }
}
