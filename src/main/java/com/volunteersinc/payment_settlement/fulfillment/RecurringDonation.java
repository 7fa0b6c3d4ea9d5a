package com.volunteersinc.payment_settlement.fulfillment;

import lombok.Value;

import java.util.UUID;

/**
 * The parts of a recurring donation needed to record one of its charges.
 */
@Value
public class RecurringDonation {
    UUID id;
    UUID causeId;
    boolean anonymous;
}
