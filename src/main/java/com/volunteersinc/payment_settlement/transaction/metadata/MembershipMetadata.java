package com.volunteersinc.payment_settlement.transaction.metadata;

import com.volunteersinc.payment_settlement.transaction.BillingFrequency;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Metadata of membership and organization-membership payments.
 *
 * {@code payment_subscriptions_id} links the one-time charge to the
 * subscription it started; {@code frequency} is the plan cadence.
 */
@Value
public class MembershipMetadata implements TransactionMetadata {
    UUID subscriptionRef;
    BillingFrequency frequency;

    public Optional<UUID> subscription() {
        return Optional.ofNullable(subscriptionRef);
    }

    public Optional<BillingFrequency> billingFrequency() {
        return Optional.ofNullable(frequency);
    }
}
