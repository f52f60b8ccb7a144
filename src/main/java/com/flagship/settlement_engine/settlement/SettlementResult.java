package com.flagship.settlement_engine.settlement;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class SettlementResult {
    Outcome outcome;
    UUID orderId;
    UUID batchId;
    List<UUID> entryIds;

    public enum Outcome {
        SETTLED,
        ALREADY_SETTLED
    }

    public static SettlementResult settled(UUID orderId, UUID batchId, List<UUID> entryIds) {
        return new SettlementResult(Outcome.SETTLED, orderId, batchId, entryIds);
    }

    public static SettlementResult alreadySettled(UUID orderId) {
        return new SettlementResult(Outcome.ALREADY_SETTLED, orderId, null, List.of());
    }

    public boolean isNewlySettled() {
        return outcome == Outcome.SETTLED;
    }

    public String describe() {
        return isNewlySettled()
            ? String.format("settled order %s in batch %s (%d entries)", orderId, batchId, entryIds.size())
            : String.format("order %s already settled", orderId);
    }
}
