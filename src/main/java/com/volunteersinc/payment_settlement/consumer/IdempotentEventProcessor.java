package com.volunteersinc.payment_settlement.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The processed_events row is written in the same transaction as the
 * handler's own writes, so a crash between the two replays the event
 * rather than losing it. Handler failures are rethrown without a record
 * and the broker redelivers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage());
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, Instant.now(clock)
        )));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event as not relevant to this consumer so it is never replayed.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, Instant.now(clock), reason
        )));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
