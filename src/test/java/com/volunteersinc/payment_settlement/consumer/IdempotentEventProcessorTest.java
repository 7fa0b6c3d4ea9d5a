package com.volunteersinc.payment_settlement.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent processing against a real processed_events table.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payment_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "SettlementFulfillmentFailed";
    private static final String AGGREGATE_TYPE = "PaymentTransaction";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void firstDeliveryRunsHandler() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, UUID.randomUUID(), CONSUMER_GROUP,
            calls::incrementAndGet
        );

        assertTrue(processed);
        assertEquals(1, calls.get());
        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, entity.getProcessingResult());
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void redeliverySkipsHandler() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A failing handler leaves no record so the event is retried")
    void failureLeavesNoRecord() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            () -> {
                throw new IllegalStateException("donation update failed");
            }
        ));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        AtomicInteger calls = new AtomicInteger();
        assertTrue(eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A skipped event is recorded with its reason and never processed")
    void skipPreventsProcessing() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
                "Transaction not found");
        boolean processed = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, calls::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, calls.get());
        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
        assertEquals("Transaction not found", entity.getNote());
    }

    @Test
    @DisplayName("Processed events are listed per aggregate in processing order")
    void listsByAggregate() {
        UUID aggregateId = UUID.randomUUID();
        eventProcessor.processEvent(UUID.randomUUID(), EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
                CONSUMER_GROUP, () -> { });
        eventProcessor.skipEvent(UUID.randomUUID(), EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
                CONSUMER_GROUP, "Transaction is not completed");

        assertEquals(2, repository
            .findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(AGGREGATE_TYPE, aggregateId).size());
        assertTrue(repository
            .findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(AGGREGATE_TYPE, UUID.randomUUID()).isEmpty());
    }
}
