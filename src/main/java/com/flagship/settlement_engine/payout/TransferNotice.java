package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.payout.transfer.TransferOutcome;
import lombok.Value;

import java.util.UUID;

/**
 * A report about a transfer, from a processor event or a lookup. Either id
 * may be missing, but not both.
 */
@Value
public class TransferNotice {
    UUID withdrawalId;
    String transferId;
    TransferOutcome outcome;
    String reason;
}
