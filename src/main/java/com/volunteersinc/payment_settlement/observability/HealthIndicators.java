package com.volunteersinc.payment_settlement.observability;

import com.volunteersinc.payment_settlement.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the fulfillment retry pipeline.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    /**
     * Each waiting fulfillment event is a paid transaction whose domain
     * records are not updated yet. A large backlog is a warning and a very
     * large one is down; any dead-lettered event is a warning until it is
     * repaired by hand.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 100;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 1000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder;
                if (backlogSize >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
