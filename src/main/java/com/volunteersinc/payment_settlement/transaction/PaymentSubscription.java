package com.volunteersinc.payment_settlement.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Recurring billing agreement. Every billing confirmation is a new charge,
 * so there is no completed state to short-circuit on.
 */
@Value
@Builder(toBuilder = true)
public class PaymentSubscription {
    UUID id;
    String gatewaySubscriptionId;
    SubscriptionType subscriptionType;
    UUID referenceId;
    UUID userId;
    BigDecimal amount;
    BillingFrequency frequency;
    LocalDate nextBillingDate;
    LocalDate lastBillingDate;
    SubscriptionStatus status;
    String transactionNumber;

    public Optional<UUID> reference() {
        return Optional.ofNullable(referenceId);
    }

    public Optional<UUID> user() {
        return Optional.ofNullable(userId);
    }

    public Optional<LocalDate> nextBilling() {
        return Optional.ofNullable(nextBillingDate);
    }

    public Optional<BillingFrequency> billingFrequency() {
        return Optional.ofNullable(frequency);
    }
}
