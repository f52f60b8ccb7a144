package com.flagship.settlement_engine.payout.transfer;

import lombok.Value;

@Value
public class TransferReceipt {
    String transferId;
    TransferStatus status;
}
