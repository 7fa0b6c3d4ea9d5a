package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.outbox.OutboxService;
import com.volunteersinc.payment_settlement.settlement.event.FulfillmentFailedEvent;
import com.volunteersinc.payment_settlement.support.SettlementFixture;
import com.volunteersinc.payment_settlement.transaction.OrderType;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.SubscriptionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FulfillmentFailureRecorderTest {

    private OutboxService outboxService;
    private FulfillmentFailureRecorder recorder;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
        recorder = new FulfillmentFailureRecorder(outboxService,
                Clock.fixed(SettlementFixture.NOW, SettlementFixture.ZONE));
    }

    @Test
    @DisplayName("A transaction failure is queued against the transaction")
    void queuesTransactionFailure() {
        PaymentTransaction transaction = SettlementFixture.pendingTransaction(OrderType.DONATION, "2500").build();
        SettlementContext context = SettlementContext.forTransaction(transaction, "TXN-1", SettlementFixture.NOW);

        FulfillmentFailedEvent event = recorder.record(context, new IllegalStateException("donation row locked"));

        assertEquals(SettlementSource.ONE_TIME, event.getSource());
        assertEquals(transaction.getId(), event.getRecordId());
        assertEquals("TXN-1", event.getTransactionNumber());
        assertEquals("donation", event.getKind());
        assertEquals("donation row locked", event.getReason());
        assertEquals(SettlementFixture.NOW, event.getOccurredAt());
        verify(outboxService).saveEvent(event.getEventId(), FulfillmentFailureRecorder.TRANSACTION_AGGREGATE,
                transaction.getId(), FulfillmentFailedEvent.EVENT_TYPE, event);
    }

    @Test
    @DisplayName("A subscription failure is queued against the subscription")
    void queuesSubscriptionFailure() {
        PaymentSubscription subscription = SettlementFixture
            .pendingSubscription(SubscriptionType.RECURRING_DONATION, "1000")
            .build();
        SettlementContext context = SettlementContext.forSubscription(subscription, "TXN-2", SettlementFixture.NOW);

        recorder.record(context, new IllegalStateException("cause missing"));

        verify(outboxService).saveEvent(any(), eq(FulfillmentFailureRecorder.SUBSCRIPTION_AGGREGATE),
                eq(subscription.getId()), eq(FulfillmentFailedEvent.EVENT_TYPE), any());
    }

    @Test
    @DisplayName("An outbox write failure reaches the caller")
    void outboxFailurePropagates() {
        PaymentTransaction transaction = SettlementFixture.pendingTransaction(OrderType.MEMBERSHIP, "3000").build();
        SettlementContext context = SettlementContext.forTransaction(transaction, "TXN-3", SettlementFixture.NOW);
        when(outboxService.saveEvent(any(), anyString(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("outbox unavailable"));

        assertThrows(IllegalStateException.class,
                () -> recorder.record(context, new IllegalStateException("membership update failed")));
    }
}
