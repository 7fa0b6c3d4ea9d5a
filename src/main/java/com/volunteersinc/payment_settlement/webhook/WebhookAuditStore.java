package com.volunteersinc.payment_settlement.webhook;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit trail of gateway webhook deliveries, one row per transaction number.
 */
public interface WebhookAuditStore {

    /**
     * @return the audit row id, or empty if a delivery with the same
     *         transaction number was already recorded
     */
    Optional<UUID> recordDelivery(WebhookDelivery delivery);

    void markProcessed(UUID id, Instant processedAt);

    void markErrored(UUID id, String errorMessage, Instant processedAt);
}
