package com.volunteersinc.payment_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in outbox_events to be published to Kafka.
 *
 * The aggregate is the ledger record the event is about: a payment
 * transaction or a payment subscription.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID id, String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
