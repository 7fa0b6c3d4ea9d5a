package com.volunteersinc.payment_settlement.fulfillment;

import java.util.Optional;
import java.util.UUID;

public interface RecurringDonationStore {

    /**
     * Sets the recurring donation active. Activating an active one is a no-op.
     */
    void activate(UUID recurringDonationId);

    Optional<RecurringDonation> findById(UUID recurringDonationId);
}
