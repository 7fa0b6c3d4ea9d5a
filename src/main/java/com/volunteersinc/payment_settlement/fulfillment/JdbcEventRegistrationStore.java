package com.volunteersinc.payment_settlement.fulfillment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.UUID;

@Repository
public class JdbcEventRegistrationStore implements EventRegistrationStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventRegistrationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean markRegistered(UUID registrationId, String transactionNumber, BigDecimal amountPaid) {
        int updated = jdbcTemplate.update(
            "UPDATE event_registrations " +
            "SET payment_status = 'Completed', status = 'Registered', transaction_number = ?, amount_paid = ? " +
            "WHERE id = ?",
            transactionNumber,
            amountPaid,
            registrationId
        );
        return updated > 0;
    }
}
