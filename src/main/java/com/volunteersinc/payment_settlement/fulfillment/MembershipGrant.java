package com.volunteersinc.payment_settlement.fulfillment;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Membership fields to apply to a user after a membership payment.
 *
 * Organizations become partner organizations; everyone else becomes a
 * premium member. Both get an active membership starting now.
 */
@Value
public class MembershipGrant {
    public static final String PREMIUM_TIER = "premium";
    public static final String ACTIVE_STATUS = "active";

    AccountType accountType;
    Instant startedAt;
    LocalDate expiresOn;

    public boolean isPartnerOrganization() {
        return accountType == AccountType.ORGANIZATION;
    }

    public Optional<LocalDate> expiry() {
        return Optional.ofNullable(expiresOn);
    }
}
