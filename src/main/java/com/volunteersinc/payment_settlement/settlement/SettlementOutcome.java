package com.volunteersinc.payment_settlement.settlement;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of settling one confirmation.
 *
 * ALREADY_SETTLED means the conditional ledger update matched no pending
 * row, so another delivery settled the transaction and no domain record
 * was touched by this one.
 */
@Value
public class SettlementOutcome {

    public enum Status {
        SETTLED,
        ALREADY_SETTLED
    }

    Status status;
    SettlementSource source;
    UUID recordId;
    DomainEffect effect;
    List<SecondaryFailure> secondaryFailures;

    public static SettlementOutcome settled(SettlementSource source, UUID recordId,
                                            DomainEffect effect, List<SecondaryFailure> secondaryFailures) {
        return new SettlementOutcome(Status.SETTLED, source, recordId, effect, List.copyOf(secondaryFailures));
    }

    public static SettlementOutcome alreadySettled(UUID transactionId) {
        return new SettlementOutcome(Status.ALREADY_SETTLED, SettlementSource.ONE_TIME, transactionId,
                DomainEffect.skipped("already settled"), List.of());
    }

    public boolean isAlreadySettled() {
        return status == Status.ALREADY_SETTLED;
    }

    public boolean hasSecondaryFailures() {
        return !secondaryFailures.isEmpty();
    }
}
