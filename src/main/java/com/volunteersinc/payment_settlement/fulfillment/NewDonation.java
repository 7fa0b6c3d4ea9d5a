package com.volunteersinc.payment_settlement.fulfillment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A donation row created for one charge of a recurring donation.
 */
@Value
@Builder
public class NewDonation {
    UUID causeId;
    UUID userId;
    BigDecimal amount;
    String currency;
    boolean anonymous;
    UUID recurringDonationId;
    String transactionNumber;
    Instant completedAt;
}
