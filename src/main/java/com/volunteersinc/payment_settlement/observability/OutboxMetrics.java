package com.volunteersinc.payment_settlement.observability;

import com.volunteersinc.payment_settlement.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * Gauge values are cached and refreshed on a fixed schedule so a scrape
 * never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetteredCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));

            long deadLettered = outboxRepository.countDeadLettered(maxRetries);
            deadLetteredCount.set(deadLettered);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), deadLettered);

        } catch (RuntimeException e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
