package com.volunteersinc.payment_settlement.transaction;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger access for recurring billing agreements.
 */
public interface SubscriptionStore {

    Optional<PaymentSubscription> findById(UUID id);

    /**
     * Looks a subscription up by the id the gateway assigned to it.
     */
    Optional<PaymentSubscription> findByGatewaySubscriptionId(String gatewaySubscriptionId);

    /**
     * Next billing date of a subscription, used when a one-time membership
     * payment points back at the subscription that created it.
     */
    Optional<LocalDate> findNextBillingDate(UUID id);

    /**
     * Records a successful billing: status active, the new transaction
     * number and last_billing_date moved to {@code billedOn}.
     *
     * @return false if no subscription row matched
     */
    boolean markBilled(UUID id, String transactionNumber, LocalDate billedOn, Instant updatedAt);

    /**
     * Records a declined billing. last_billing_date is left alone.
     */
    boolean markFailed(UUID id, String transactionNumber, Instant updatedAt);
}
