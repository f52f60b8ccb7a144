package com.flagship.settlement_engine.order;

import lombok.Value;

/**
 * Human-readable context copied onto every ledger entry of a settlement, so
 * statements stay meaningful after the booking itself is edited or removed.
 */
@Value
public class OrderContext {
    String serviceName;
    String subject;
    String payerName;
    String fulfillerName;
    String facilitatorName;

    public static OrderContext empty() {
        return new OrderContext(null, null, null, null, null);
    }
}
