package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.fulfillment.EventRegistrationStore;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public class InMemoryEventRegistrationStore implements EventRegistrationStore {

    private final Map<UUID, BigDecimal> amountPaid = new HashMap<>();
    private final Map<UUID, String> transactionNumbers = new HashMap<>();
    private final Map<UUID, Boolean> registered = new HashMap<>();

    public void addPending(UUID registrationId) {
        registered.put(registrationId, false);
    }

    public boolean isRegistered(UUID registrationId) {
        return registered.getOrDefault(registrationId, false);
    }

    public BigDecimal amountPaid(UUID registrationId) {
        return amountPaid.get(registrationId);
    }

    public String transactionNumberOf(UUID registrationId) {
        return transactionNumbers.get(registrationId);
    }

    @Override
    public boolean markRegistered(UUID registrationId, String transactionNumber, BigDecimal paid) {
        if (!registered.containsKey(registrationId)) {
            return false;
        }
        registered.put(registrationId, true);
        amountPaid.put(registrationId, paid);
        transactionNumbers.put(registrationId, transactionNumber);
        return true;
    }
}
