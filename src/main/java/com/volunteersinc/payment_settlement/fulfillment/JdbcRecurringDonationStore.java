package com.volunteersinc.payment_settlement.fulfillment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcRecurringDonationStore implements RecurringDonationStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRecurringDonationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void activate(UUID recurringDonationId) {
        jdbcTemplate.update(
            "UPDATE recurring_donations SET status = 'active', updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            recurringDonationId
        );
    }

    @Override
    public Optional<RecurringDonation> findById(UUID recurringDonationId) {
        List<RecurringDonation> rows = jdbcTemplate.query(
            "SELECT id, cause_id, is_anonymous FROM recurring_donations WHERE id = ?",
            (rs, rowNum) -> new RecurringDonation(
                rs.getObject("id", UUID.class),
                rs.getObject("cause_id", UUID.class),
                rs.getBoolean("is_anonymous")
            ),
            recurringDonationId
        );
        return rows.stream().findFirst();
    }
}
