package com.volunteersinc.payment_settlement.settlement;

/**
 * Applies the domain side of a settled payment for one business category.
 *
 * Implementations must be safe to run again for the same context: the
 * fulfillment retry path replays them after a failure.
 *
 * Any exception thrown is fatal for the settlement. Tolerated failures are
 * reported through {@link DomainEffect#getSecondaryFailures()} instead.
 */
public interface SettlementHandler {

    DomainEffect settle(SettlementContext context);
}
