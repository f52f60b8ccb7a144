package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class PostedBatch {
    UUID batchId;
    List<UUID> entryIds;
}
