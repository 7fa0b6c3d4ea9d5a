package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.fulfillment.CauseAggregateUpdater;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public class InMemoryCauseAggregateUpdater implements CauseAggregateUpdater {

    private final Map<UUID, BigDecimal> raised = new HashMap<>();
    private RuntimeException failure;

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public BigDecimal raised(UUID causeId) {
        return raised.getOrDefault(causeId, BigDecimal.ZERO);
    }

    @Override
    public void incrementRaisedAmount(UUID causeId, BigDecimal amount) {
        if (failure != null) {
            throw failure;
        }
        raised.merge(causeId, amount, BigDecimal::add);
    }
}
