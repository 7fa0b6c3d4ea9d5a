package com.volunteersinc.payment_settlement.settlement.handler;

import com.volunteersinc.payment_settlement.fulfillment.AccountType;
import com.volunteersinc.payment_settlement.fulfillment.MembershipGrant;
import com.volunteersinc.payment_settlement.fulfillment.MembershipStore;
import com.volunteersinc.payment_settlement.settlement.DomainEffect;
import com.volunteersinc.payment_settlement.settlement.MembershipExpiryPolicy;
import com.volunteersinc.payment_settlement.settlement.SettlementContext;
import com.volunteersinc.payment_settlement.settlement.SettlementHandler;
import com.volunteersinc.payment_settlement.settlement.SettlementSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Activates the paying user's membership.
 *
 * Serves membership and organization-membership payments on both the
 * one-time and the subscription path; only the expiry source differs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MembershipSettlementHandler implements SettlementHandler {

    private final MembershipStore membershipStore;
    private final MembershipExpiryPolicy expiryPolicy;

    @Override
    public DomainEffect settle(SettlementContext context) {
        if (context.user().isEmpty()) {
            log.warn("Membership payment has no user_id, skipping update: recordId={}", context.getRecordId());
            return DomainEffect.skipped("no user");
        }

        UUID userId = context.getUserId();
        Optional<AccountType> accountType = membershipStore.findAccountType(userId);
        if (accountType.isEmpty()) {
            log.warn("Membership user not found, skipping update: userId={}", userId);
            return DomainEffect.skipped("user not found");
        }

        LocalDate expiresOn = context.getSource() == SettlementSource.SUBSCRIPTION
            ? expiryPolicy.forSubscription(context.getSubscription())
            : expiryPolicy.forTransaction(context.getMetadata());

        MembershipGrant grant = new MembershipGrant(accountType.get(), context.getSettledAt(), expiresOn);
        if (!membershipStore.applyMembership(userId, grant)) {
            throw new IllegalStateException("User membership update matched no rows: " + userId);
        }

        log.info("User membership activated: userId={}, accountType={}, expiresOn={}",
                userId, grant.getAccountType(), expiresOn);
        return DomainEffect.applied("membership of user " + userId + " active until " + expiresOn);
    }
}
