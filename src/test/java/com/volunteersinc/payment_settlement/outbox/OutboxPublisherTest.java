package com.volunteersinc.payment_settlement.outbox;

import com.volunteersinc.payment_settlement.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxPublisherTest {

    private static final String TOPIC = "settlement-events";
    private static final int MAX_RETRIES = 3;

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        OutboxMetrics metrics = new OutboxMetrics(mock(OutboxEventRepository.class), meterRegistry,
                Clock.systemUTC(), MAX_RETRIES);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, metrics, TOPIC, 10, MAX_RETRIES, 1000);
    }

    @Test
    @DisplayName("Events are keyed by aggregate id and marked published")
    void publishesKeyedByAggregate() {
        OutboxEvent event = event();
        when(outboxService.findPublishableEvents(10, MAX_RETRIES)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(CompletableFuture.completedFuture(sent(event)));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        assertEquals(1.0, meterRegistry.counter("outbox.events.published",
                "event_type", event.getEventType(), "status", "success").count());
    }

    @Test
    @DisplayName("A failed send is recorded for retry and the event stays unpublished")
    void failedSendIsRetried() {
        OutboxEvent event = event();
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(1);

        publisher.publishEvent(event);

        verify(outboxService, never()).markPublished(event.getId());
        assertEquals(1.0, meterRegistry.counter("outbox.events.published",
                "event_type", event.getEventType(), "status", "failure").count());
        assertEquals(0.0, meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", event.getEventType()).count());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void deadLettersAfterMaxRetries() {
        OutboxEvent event = event();
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(MAX_RETRIES);

        publisher.publishEvent(event);

        assertEquals(1.0, meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", event.getEventType()).count());
    }

    @Test
    @DisplayName("A failing poll is logged and does not throw")
    void pollFailure() {
        when(outboxService.findPublishableEvents(10, MAX_RETRIES))
            .thenThrow(new IllegalStateException("connection refused"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
    }

    private static OutboxEvent event() {
        return OutboxEvent.create(UUID.randomUUID(), "PaymentTransaction", UUID.randomUUID(),
                "SettlementFulfillmentFailed", "{\"kind\":\"donation\"}", Instant.parse("2025-01-15T15:00:00Z"));
    }

    private static SendResult<String, String> sent(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 7L, 0, 0L, 0, 0);
        return new SendResult<>(record, metadata);
    }
}
