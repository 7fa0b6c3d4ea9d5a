package com.volunteersinc.payment_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an event a consumer group has already handled.
 *
 * Only handled events are recorded. A failed attempt leaves no record so
 * the redelivered message is processed again.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
                consumerGroup, processedAt, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
                consumerGroup, processedAt, ProcessingResult.SKIPPED, reason);
    }
}
