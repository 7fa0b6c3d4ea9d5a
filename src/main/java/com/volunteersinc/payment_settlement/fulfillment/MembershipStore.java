package com.volunteersinc.payment_settlement.fulfillment;

import java.util.Optional;
import java.util.UUID;

public interface MembershipStore {

    /**
     * @return the user's account type, or empty if the user does not exist
     */
    Optional<AccountType> findAccountType(UUID userId);

    /**
     * @return false if no user row matched
     */
    boolean applyMembership(UUID userId, MembershipGrant grant);
}
