package com.volunteersinc.payment_settlement.fulfillment;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Donation records that payments settle.
 */
public interface DonationStore {

    /**
     * Marks a pending donation paid.
     *
     * @return true if the donation moved to completed in this call; false if
     *         it was already completed or does not exist
     */
    boolean markCompleted(UUID donationId, String transactionNumber, Instant completedAt);

    Optional<UUID> findCauseId(UUID donationId);

    /**
     * Inserts a completed donation produced by a recurring charge.
     *
     * @return false if a donation for the same recurring donation and
     *         transaction number already exists
     */
    boolean insertCompleted(NewDonation donation);
}
