package com.volunteersinc.payment_settlement.fulfillment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Delegates to the increment_cause_amount stored function, which adds to
 * causes.amount_raised in one UPDATE.
 */
@Repository
public class JdbcCauseAggregateUpdater implements CauseAggregateUpdater {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCauseAggregateUpdater(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void incrementRaisedAmount(UUID causeId, BigDecimal amount) {
        jdbcTemplate.queryForList(
            "SELECT increment_cause_amount(?, ?)",
            causeId,
            amount
        );
    }
}
