package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStatus;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemorySubscriptionStore implements SubscriptionStore {

    private final Map<UUID, PaymentSubscription> subscriptions = new HashMap<>();
    private RuntimeException failure;

    public void put(PaymentSubscription subscription) {
        subscriptions.put(subscription.getId(), subscription);
    }

    public PaymentSubscription get(UUID id) {
        return subscriptions.get(id);
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public Optional<PaymentSubscription> findById(UUID id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    @Override
    public Optional<PaymentSubscription> findByGatewaySubscriptionId(String gatewaySubscriptionId) {
        return subscriptions.values().stream()
            .filter(subscription -> gatewaySubscriptionId.equals(subscription.getGatewaySubscriptionId()))
            .findFirst();
    }

    @Override
    public Optional<LocalDate> findNextBillingDate(UUID id) {
        return findById(id).flatMap(PaymentSubscription::nextBilling);
    }

    @Override
    public boolean markBilled(UUID id, String transactionNumber, LocalDate billedOn, Instant updatedAt) {
        if (failure != null) {
            throw failure;
        }
        PaymentSubscription current = subscriptions.get(id);
        if (current == null) {
            return false;
        }
        subscriptions.put(id, current.toBuilder()
            .status(SubscriptionStatus.ACTIVE)
            .transactionNumber(transactionNumber)
            .lastBillingDate(billedOn)
            .build());
        return true;
    }

    @Override
    public boolean markFailed(UUID id, String transactionNumber, Instant updatedAt) {
        PaymentSubscription current = subscriptions.get(id);
        if (current == null) {
            return false;
        }
        subscriptions.put(id, current.toBuilder()
            .status(SubscriptionStatus.FAILED)
            .transactionNumber(transactionNumber)
            .build());
        return true;
    }
}
