package com.volunteersinc.payment_settlement.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to payment_subscriptions.
 */
@Repository
@Slf4j
public class JdbcSubscriptionStore implements SubscriptionStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcSubscriptionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final String SELECT_COLUMNS =
        "SELECT id, gateway_subscription_id, subscription_type, reference_id, user_id, amount, frequency, next_billing_date, " +
        "last_billing_date, status, transaction_number FROM payment_subscriptions";

    @Override
    public Optional<PaymentSubscription> findById(UUID id) {
        List<PaymentSubscription> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = ?",
            subscriptionRowMapper(),
            id
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<PaymentSubscription> findByGatewaySubscriptionId(String gatewaySubscriptionId) {
        List<PaymentSubscription> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE gateway_subscription_id = ?",
            subscriptionRowMapper(),
            gatewaySubscriptionId
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<LocalDate> findNextBillingDate(UUID id) {
        List<LocalDate> rows = jdbcTemplate.query(
            "SELECT next_billing_date FROM payment_subscriptions WHERE id = ?",
            (rs, rowNum) -> toLocalDate(rs.getDate("next_billing_date")),
            id
        );
        return rows.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public boolean markBilled(UUID id, String transactionNumber, LocalDate billedOn, Instant updatedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE payment_subscriptions " +
            "SET status = ?, transaction_number = ?, last_billing_date = ?, updated_at = ? " +
            "WHERE id = ?",
            SubscriptionStatus.ACTIVE.getCode(),
            transactionNumber,
            Date.valueOf(billedOn),
            Timestamp.from(updatedAt),
            id
        );
        return updated > 0;
    }

    @Override
    public boolean markFailed(UUID id, String transactionNumber, Instant updatedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE payment_subscriptions SET status = ?, transaction_number = ?, updated_at = ? WHERE id = ?",
            SubscriptionStatus.FAILED.getCode(),
            transactionNumber,
            Timestamp.from(updatedAt),
            id
        );
        return updated > 0;
    }

    private RowMapper<PaymentSubscription> subscriptionRowMapper() {
        return (rs, rowNum) -> {
            String rawReference = rs.getString("reference_id");
            Optional<UUID> reference = ReferenceIds.parse(rawReference);
            if (rawReference != null && !rawReference.isBlank() && reference.isEmpty()) {
                log.warn("Ignoring malformed reference_id on subscription: subscriptionId={}, referenceId={}",
                        rs.getString("id"), rawReference);
            }
            return PaymentSubscription.builder()
                .id(rs.getObject("id", UUID.class))
                .gatewaySubscriptionId(rs.getString("gateway_subscription_id"))
                .subscriptionType(SubscriptionType.fromCode(rs.getString("subscription_type")))
                .referenceId(reference.orElse(null))
                .userId(rs.getObject("user_id", UUID.class))
                .amount(rs.getBigDecimal("amount"))
                .frequency(BillingFrequency.fromCode(rs.getString("frequency")).orElse(null))
                .nextBillingDate(toLocalDate(rs.getDate("next_billing_date")))
                .lastBillingDate(toLocalDate(rs.getDate("last_billing_date")))
                .status(SubscriptionStatus.fromCode(rs.getString("status")))
                .transactionNumber(rs.getString("transaction_number"))
                .build();
        };
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }
}
