package com.volunteersinc.payment_settlement.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes and tracks events in the outbox.
 *
 * Settlement runs as a sequence of separately committed steps, so an event
 * recorded after a failed step must commit on its own: saveEvent always
 * runs in a new transaction and survives the caller's failure.
 */
@Service
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxService(OutboxEventRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Saves an event to the outbox in its own transaction.
     *
     * @param eventId id of the event, also used by consumers for deduplication
     * @param payload serialized to JSON
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent saveEvent(UUID eventId, String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(eventId, aggregateType, aggregateId, eventType,
                jsonPayload, clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.info("Saved outbox event: eventId={}, type={}, aggregateType={}, aggregateId={}",
                eventId, eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    /**
     * Fetches unpublished events with retries left, skipping rows another
     * publisher holds.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * @return the retry count after this failure, or -1 if the event is gone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(-1);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
