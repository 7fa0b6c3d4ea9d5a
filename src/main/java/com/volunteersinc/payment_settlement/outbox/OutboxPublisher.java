package com.volunteersinc.payment_settlement.outbox;

import com.volunteersinc.payment_settlement.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes events to the settlement-events topic.
 *
 * Events are sent one at a time and keyed by aggregate id, so all events
 * of one transaction or subscription land on the same partition in order.
 * An event whose send fails is retried on later polls until it reaches
 * the retry limit, after which it stays in the table as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String settlementEventsTopic;
    private final int batchSize;
    private final int maxRetries;
    private final long sendTimeoutMs;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.settlement-events:settlement-events}") String settlementEventsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                           @Value("${outbox.publisher.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.settlementEventsTopic = settlementEventsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed: {}", e.getMessage(), e);
            return;
        }

        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(settlementEventsTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while publishing");
        } catch (Exception e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String reason) {
        log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), reason);
        int retries = outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (retries >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
