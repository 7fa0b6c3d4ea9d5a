package com.volunteersinc.payment_settlement.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to payment_webhooks. The unique transaction_number makes the
 * insert itself the duplicate check.
 */
@Repository
public class JdbcWebhookAuditStore implements WebhookAuditStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcWebhookAuditStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UUID> recordDelivery(WebhookDelivery delivery) {
        UUID id = UUID.randomUUID();
        int inserted = jdbcTemplate.update(
            "INSERT INTO payment_webhooks (id, event_type, transaction_number, payload, headers, processed) " +
            "VALUES (?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), FALSE) " +
            "ON CONFLICT (transaction_number) DO NOTHING",
            id,
            delivery.getEventType().getCode(),
            delivery.getTransactionNumber(),
            toJson(delivery.getPayload()),
            delivery.getHeaders() != null ? toJson(delivery.getHeaders()) : null
        );
        return inserted > 0 ? Optional.of(id) : Optional.empty();
    }

    @Override
    public void markProcessed(UUID id, Instant processedAt) {
        jdbcTemplate.update(
            "UPDATE payment_webhooks SET processed = TRUE, error_message = NULL, processed_at = ? WHERE id = ?",
            Timestamp.from(processedAt),
            id
        );
    }

    @Override
    public void markErrored(UUID id, String errorMessage, Instant processedAt) {
        jdbcTemplate.update(
            "UPDATE payment_webhooks SET processed = FALSE, error_message = ?, processed_at = ? WHERE id = ?",
            errorMessage,
            Timestamp.from(processedAt),
            id
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize webhook audit data", e);
        }
    }
}
