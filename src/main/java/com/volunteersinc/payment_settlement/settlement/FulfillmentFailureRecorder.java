package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.observability.CorrelationContext;
import com.volunteersinc.payment_settlement.outbox.OutboxService;
import com.volunteersinc.payment_settlement.settlement.event.FulfillmentFailedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Queues a fulfillment retry for a settlement whose domain update failed.
 */
@Component
@Slf4j
public class FulfillmentFailureRecorder {

    public static final String TRANSACTION_AGGREGATE = "PaymentTransaction";
    public static final String SUBSCRIPTION_AGGREGATE = "PaymentSubscription";

    private final OutboxService outboxService;
    private final Clock clock;

    public FulfillmentFailureRecorder(OutboxService outboxService, Clock clock) {
        this.outboxService = outboxService;
        this.clock = clock;
    }

    /**
     * Writes a {@link FulfillmentFailedEvent} to the outbox in its own
     * transaction.
     *
     * @throws RuntimeException if the outbox write fails; the caller then
     *         has nothing queued and must surface that
     */
    public FulfillmentFailedEvent record(SettlementContext context, Throwable cause) {
        FulfillmentFailedEvent event = new FulfillmentFailedEvent(
            UUID.randomUUID(),
            context.getSource(),
            context.getRecordId(),
            context.getTransactionNumber(),
            context.getKind(),
            cause.getMessage(),
            CorrelationContext.getCorrelationId(),
            clock.instant()
        );

        String aggregateType = context.getSource() == SettlementSource.SUBSCRIPTION
            ? SUBSCRIPTION_AGGREGATE
            : TRANSACTION_AGGREGATE;

        outboxService.saveEvent(event.getEventId(), aggregateType, context.getRecordId(),
                FulfillmentFailedEvent.EVENT_TYPE, event);

        log.warn("Fulfillment retry queued: eventId={}, source={}, recordId={}, kind={}",
                event.getEventId(), context.getSource(), context.getRecordId(), context.getKind());
        return event;
    }
}
