package com.volunteersinc.payment_settlement.fulfillment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to donations.
 *
 * Both write paths are idempotent at the database: completion is
 * conditional on the current payment_status, and recurring inserts rely on
 * the unique (recurring_donation_id, transaction_number) constraint.
 */
@Repository
public class JdbcDonationStore implements DonationStore {

    static final String COMPLETED = "completed";

    private final JdbcTemplate jdbcTemplate;

    public JdbcDonationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean markCompleted(UUID donationId, String transactionNumber, Instant completedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE donations SET payment_status = ?, completed_at = ?, transaction_number = ? " +
            "WHERE id = ? AND payment_status IS DISTINCT FROM ?",
            COMPLETED,
            Timestamp.from(completedAt),
            transactionNumber,
            donationId,
            COMPLETED
        );
        return updated > 0;
    }

    @Override
    public Optional<UUID> findCauseId(UUID donationId) {
        List<UUID> rows = jdbcTemplate.query(
            "SELECT cause_id FROM donations WHERE id = ?",
            (rs, rowNum) -> rs.getObject("cause_id", UUID.class),
            donationId
        );
        return rows.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public boolean insertCompleted(NewDonation donation) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO donations (id, cause_id, user_id, amount, currency, is_anonymous, payment_status, " +
            "recurring_donation_id, completed_at, transaction_number, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (recurring_donation_id, transaction_number) DO NOTHING",
            donation.getCauseId(),
            donation.getUserId(),
            donation.getAmount(),
            donation.getCurrency(),
            donation.isAnonymous(),
            COMPLETED,
            donation.getRecurringDonationId(),
            Timestamp.from(donation.getCompletedAt()),
            donation.getTransactionNumber()
        );
        return inserted > 0;
    }
}
