package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.fulfillment.CauseAggregateUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Adds a settled donation to its cause's running total.
 *
 * The donation itself is already recorded when this runs, so a failed
 * increment is reported as a secondary failure and never propagates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CauseProgressRecorder {

    private final CauseAggregateUpdater aggregateUpdater;

    public Optional<SecondaryFailure> record(UUID causeId, BigDecimal amount) {
        try {
            aggregateUpdater.incrementRaisedAmount(causeId, amount);
            log.info("Cause amount incremented: causeId={}, amount={}", causeId, amount);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Cause increment failed, donation stays recorded: causeId={}, amount={}, error={}",
                    causeId, amount, e.getMessage());
            return Optional.of(SecondaryFailure.of(SecondaryEffect.CAUSE_AGGREGATE, e));
        }
    }
}
