package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.transaction.BillingFrequency;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;
import com.volunteersinc.payment_settlement.transaction.metadata.MembershipMetadata;
import com.volunteersinc.payment_settlement.transaction.metadata.TransactionMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Decides when a membership granted by a payment expires.
 *
 * Order of precedence: the linked subscription's next billing date, then
 * the plan frequency applied to today, then one month from today. "Today"
 * is taken from the injected clock, whose zone is the platform zone.
 */
@Component
@Slf4j
public class MembershipExpiryPolicy {

    static final BillingFrequency DEFAULT_FREQUENCY = BillingFrequency.MONTHLY;

    private final SubscriptionStore subscriptionStore;
    private final Clock clock;

    public MembershipExpiryPolicy(SubscriptionStore subscriptionStore, Clock clock) {
        this.subscriptionStore = subscriptionStore;
        this.clock = clock;
    }

    public LocalDate forTransaction(TransactionMetadata metadata) {
        if (metadata instanceof MembershipMetadata membership) {
            Optional<LocalDate> linked = membership.subscription()
                .flatMap(subscriptionStore::findNextBillingDate);
            if (linked.isPresent()) {
                return linked.get();
            }
            if (membership.subscription().isPresent()) {
                log.warn("Linked subscription has no next billing date, falling back: subscriptionRef={}",
                        membership.getSubscriptionRef());
            }
            return fromFrequency(membership.billingFrequency());
        }
        return fromFrequency(Optional.empty());
    }

    public LocalDate forSubscription(PaymentSubscription subscription) {
        return subscription.nextBilling()
            .orElseGet(() -> fromFrequency(subscription.billingFrequency()));
    }

    private LocalDate fromFrequency(Optional<BillingFrequency> frequency) {
        return frequency.orElse(DEFAULT_FREQUENCY).advance(LocalDate.now(clock));
    }
}
