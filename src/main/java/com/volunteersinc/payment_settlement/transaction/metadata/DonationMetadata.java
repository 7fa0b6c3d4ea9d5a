package com.volunteersinc.payment_settlement.transaction.metadata;

import lombok.Value;

import java.util.Optional;
import java.util.UUID;

@Value
public class DonationMetadata implements TransactionMetadata {
    UUID causeId;

    public Optional<UUID> cause() {
        return Optional.ofNullable(causeId);
    }
}
