package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.fulfillment.AccountType;
import com.volunteersinc.payment_settlement.fulfillment.MembershipGrant;
import com.volunteersinc.payment_settlement.fulfillment.MembershipStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryMembershipStore implements MembershipStore {

    private final Map<UUID, AccountType> users = new HashMap<>();
    private final Map<UUID, MembershipGrant> grants = new HashMap<>();

    public void addUser(UUID userId, AccountType accountType) {
        users.put(userId, accountType);
    }

    public MembershipGrant grantOf(UUID userId) {
        return grants.get(userId);
    }

    @Override
    public Optional<AccountType> findAccountType(UUID userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public boolean applyMembership(UUID userId, MembershipGrant grant) {
        if (!users.containsKey(userId)) {
            return false;
        }
        grants.put(userId, grant);
        return true;
    }
}
