package com.volunteersinc.payment_settlement.transaction;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger access for one-time payment transactions.
 */
public interface TransactionStore {

    Optional<PaymentTransaction> findById(UUID id);

    Optional<PaymentTransaction> findByOrderId(String orderId);

    /**
     * Marks the transaction completed if it is still pending.
     *
     * @return true if this call performed the transition, false if the row
     *         had already left pending (a concurrent delivery won, or it was
     *         failed or refunded in the meantime)
     */
    boolean markCompleted(UUID id, String transactionNumber, Instant completedAt);

    /**
     * Records a gateway decline on a pending transaction.
     *
     * @return false if the row was no longer pending
     */
    boolean markFailed(UUID id, String transactionNumber, GatewayResponse response, Instant failedAt);
}
