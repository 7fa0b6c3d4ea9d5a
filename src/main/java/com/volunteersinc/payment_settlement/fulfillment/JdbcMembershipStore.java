package com.volunteersinc.payment_settlement.fulfillment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Membership columns on the users table.
 */
@Repository
public class JdbcMembershipStore implements MembershipStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcMembershipStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<AccountType> findAccountType(UUID userId) {
        List<AccountType> rows = jdbcTemplate.query(
            "SELECT account_type FROM users WHERE id = ?",
            (rs, rowNum) -> AccountType.fromCode(rs.getString("account_type")),
            userId
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean applyMembership(UUID userId, MembershipGrant grant) {
        Timestamp startedAt = Timestamp.from(grant.getStartedAt());
        Date expiresOn = grant.expiry().map(Date::valueOf).orElse(null);

        // An absent expiry leaves the stored one untouched.
        int updated;
        if (grant.isPartnerOrganization()) {
            updated = jdbcTemplate.update(
                "UPDATE users SET is_partner_organization = TRUE, membership_status = ?, " +
                "subscription_start_date = ?, membership_expires_at = COALESCE(CAST(? AS DATE), membership_expires_at) " +
                "WHERE id = ?",
                MembershipGrant.ACTIVE_STATUS,
                startedAt,
                expiresOn,
                userId
            );
        } else {
            updated = jdbcTemplate.update(
                "UPDATE users SET is_premium = TRUE, membership_tier = ?, membership_status = ?, " +
                "subscription_start_date = ?, membership_expires_at = COALESCE(CAST(? AS DATE), membership_expires_at) " +
                "WHERE id = ?",
                MembershipGrant.PREMIUM_TIER,
                MembershipGrant.ACTIVE_STATUS,
                startedAt,
                expiresOn,
                userId
            );
        }
        return updated > 0;
    }
}
