package com.volunteersinc.payment_settlement.observability;

import com.volunteersinc.payment_settlement.settlement.SecondaryEffect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for payment confirmations and their side effects.
 *
 * Metrics exposed:
 * - settlement.confirmations{kind,result}: confirmations by category and outcome
 * - settlement.latency{kind}: time to handle a confirmation
 * - settlement.already_processed: confirmations short-circuited as duplicates
 * - settlement.secondary_failures{effect}: tolerated side-effect failures
 * - settlement.webhooks{outcome}: gateway callbacks by outcome
 * - notification.push{result}: per-recipient push deliveries
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordConfirmation(String kind, String result) {
        registry.counter("settlement.confirmations",
                "kind", sanitizeTag(kind),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordLatency(String kind, long durationMs) {
        registry.timer("settlement.latency",
                "kind", sanitizeTag(kind)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordAlreadyProcessed() {
        registry.counter("settlement.already_processed").increment();
    }

    public void recordSecondaryFailure(SecondaryEffect effect) {
        registry.counter("settlement.secondary_failures",
                "effect", effect.getTag()
        ).increment();
    }

    public void recordWebhook(String outcome) {
        registry.counter("settlement.webhooks",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPush(boolean delivered) {
        registry.counter("notification.push",
                "result", delivered ? "delivered" : "failed"
        ).increment();
    }

    /**
     * Keeps tag values to a bounded, metric-safe alphabet.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
