package com.volunteersinc.payment_settlement.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Unpublished events still eligible for publishing, oldest first.
     * Rows locked by another publisher are skipped.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findPublishableForUpdate(@Param("limit") int limit,
                                                     @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Unpublished events that exhausted their retries.
     */
    @Query("""
        SELECT COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries
        """)
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
