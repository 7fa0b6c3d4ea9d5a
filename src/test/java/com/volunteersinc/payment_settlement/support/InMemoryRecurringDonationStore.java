package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.fulfillment.RecurringDonation;
import com.volunteersinc.payment_settlement.fulfillment.RecurringDonationStore;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public class InMemoryRecurringDonationStore implements RecurringDonationStore {

    private final Map<UUID, RecurringDonation> recurringDonations = new HashMap<>();
    private final Set<UUID> active = new HashSet<>();

    public void put(RecurringDonation recurringDonation) {
        recurringDonations.put(recurringDonation.getId(), recurringDonation);
    }

    public boolean isActive(UUID id) {
        return active.contains(id);
    }

    @Override
    public void activate(UUID recurringDonationId) {
        if (recurringDonations.containsKey(recurringDonationId)) {
            active.add(recurringDonationId);
        }
    }

    @Override
    public Optional<RecurringDonation> findById(UUID recurringDonationId) {
        return Optional.ofNullable(recurringDonations.get(recurringDonationId));
    }
}
