package com.volunteersinc.payment_settlement.fulfillment;

import java.math.BigDecimal;
import java.util.UUID;

public interface EventRegistrationStore {

    /**
     * Marks the registration paid and registered.
     *
     * @return false if no registration row matched
     */
    boolean markRegistered(UUID registrationId, String transactionNumber, BigDecimal amountPaid);
}
