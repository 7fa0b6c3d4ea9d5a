package com.volunteersinc.payment_settlement.fulfillment;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Atomic increment of a cause's raised amount.
 *
 * Implementations must add in a single statement so concurrent settlements
 * for the same cause never lose an update.
 */
public interface CauseAggregateUpdater {

    void incrementRaisedAmount(UUID causeId, BigDecimal amount);
}
