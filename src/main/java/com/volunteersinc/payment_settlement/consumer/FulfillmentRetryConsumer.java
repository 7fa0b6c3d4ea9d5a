package com.volunteersinc.payment_settlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volunteersinc.payment_settlement.observability.CorrelationContext;
import com.volunteersinc.payment_settlement.settlement.FulfillmentFailureRecorder;
import com.volunteersinc.payment_settlement.settlement.SettlementEngine;
import com.volunteersinc.payment_settlement.settlement.SettlementOutcome;
import com.volunteersinc.payment_settlement.settlement.SettlementSource;
import com.volunteersinc.payment_settlement.settlement.event.FulfillmentFailedEvent;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;
import com.volunteersinc.payment_settlement.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Replays the domain side of settlements whose fulfillment failed.
 *
 * The ledger record is already settled when these events are written, so
 * only the handler dispatch runs again. Offsets are committed after the
 * replay succeeds; a failed replay is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FulfillmentRetryConsumer {

    static final String CONSUMER_GROUP = "settlement-fulfillment-retry";

    private final IdempotentEventProcessor eventProcessor;
    private final SettlementEngine settlementEngine;
    private final TransactionStore transactionStore;
    private final SubscriptionStore subscriptionStore;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.settlement-events:settlement-events}",
        groupId = "${spring.kafka.consumer.group-id:payment-settlement-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Optional<FulfillmentFailedEvent> parsed = parseEvent(record.value());
        if (parsed.isEmpty()) {
            log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        FulfillmentFailedEvent event = parsed.get();
        CorrelationContext.begin(event.getCorrelationId());
        try {
            boolean processed = replay(event);
            ack.acknowledge();
            if (processed) {
                log.info("Fulfillment replayed: eventId={}, source={}, recordId={}",
                        event.getEventId(), event.getSource(), event.getRecordId());
            }
        } catch (RuntimeException e) {
            log.error("Error replaying fulfillment at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    boolean replay(FulfillmentFailedEvent event) {
        if (event.getSource() == SettlementSource.SUBSCRIPTION) {
            Optional<PaymentSubscription> subscription = subscriptionStore.findById(event.getRecordId());
            if (subscription.isEmpty()) {
                skip(event, FulfillmentFailureRecorder.SUBSCRIPTION_AGGREGATE, "Subscription not found");
                return false;
            }
            return eventProcessor.processEvent(
                event.getEventId(), event.getEventType(),
                FulfillmentFailureRecorder.SUBSCRIPTION_AGGREGATE, event.getRecordId(),
                CONSUMER_GROUP,
                () -> logOutcome(settlementEngine.refulfill(subscription.get(), event.getTransactionNumber()))
            );
        }

        Optional<PaymentTransaction> transaction = transactionStore.findById(event.getRecordId());
        if (transaction.isEmpty()) {
            skip(event, FulfillmentFailureRecorder.TRANSACTION_AGGREGATE, "Transaction not found");
            return false;
        }
        if (!transaction.get().isCompleted()) {
            skip(event, FulfillmentFailureRecorder.TRANSACTION_AGGREGATE, "Transaction is not completed");
            return false;
        }
        return eventProcessor.processEvent(
            event.getEventId(), event.getEventType(),
            FulfillmentFailureRecorder.TRANSACTION_AGGREGATE, event.getRecordId(),
            CONSUMER_GROUP,
            () -> logOutcome(settlementEngine.refulfill(transaction.get(), event.getTransactionNumber()))
        );
    }

    private void skip(FulfillmentFailedEvent event, String aggregateType, String reason) {
        log.warn("Skipping fulfillment replay: eventId={}, recordId={}, reason={}",
                event.getEventId(), event.getRecordId(), reason);
        eventProcessor.skipEvent(event.getEventId(), event.getEventType(),
                aggregateType, event.getRecordId(), CONSUMER_GROUP, reason);
    }

    private void logOutcome(SettlementOutcome outcome) {
        if (outcome.hasSecondaryFailures()) {
            log.warn("Fulfillment replay completed with secondary failures: recordId={}, failures={}",
                    outcome.getRecordId(), outcome.getSecondaryFailures().size());
        }
    }

    private Optional<FulfillmentFailedEvent> parseEvent(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            FulfillmentFailedEvent event = objectMapper.readValue(json, FulfillmentFailedEvent.class);
            if (event.getEventId() == null || event.getRecordId() == null || event.getSource() == null) {
                return Optional.empty();
            }
            return Optional.of(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse fulfillment event: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
