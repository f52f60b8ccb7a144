package com.flagship.settlement_engine.payout.transfer;

import java.util.Optional;
import java.util.UUID;

/**
 * Outbound money movement to beneficiaries.
 */
public interface TransferClient {

    /**
     * Submits a transfer.
     *
     * @throws TransferDeclinedException       the API refused the transfer; no money moved
     * @throws TransferOutcomeUnknownException the call failed in a way that leaves the outcome open
     * @throws TransferUnavailableException    the API is known to be down; nothing was sent
     */
    TransferReceipt submit(TransferRequest request);

    /**
     * Looks a transfer up by the withdrawal that requested it.
     *
     * @return empty if the API has no transfer for this withdrawal
     * @throws TransferOutcomeUnknownException if the lookup itself failed
     */
    Optional<TransferReceipt> lookup(UUID withdrawalId);
}
