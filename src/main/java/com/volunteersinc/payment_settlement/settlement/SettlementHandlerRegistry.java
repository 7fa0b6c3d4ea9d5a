package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.settlement.handler.DonationSettlementHandler;
import com.volunteersinc.payment_settlement.settlement.handler.EventRegistrationSettlementHandler;
import com.volunteersinc.payment_settlement.settlement.handler.MembershipSettlementHandler;
import com.volunteersinc.payment_settlement.settlement.handler.RecurringDonationSettlementHandler;
import com.volunteersinc.payment_settlement.settlement.handler.UnhandledKindSettlementHandler;
import com.volunteersinc.payment_settlement.transaction.OrderType;
import com.volunteersinc.payment_settlement.transaction.SubscriptionType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatch tables from payment category to handler.
 *
 * The tables are filled through exhaustive switches, so adding a category
 * without deciding its handler does not compile.
 */
@Component
public class SettlementHandlerRegistry {

    private final Map<OrderType, SettlementHandler> oneTimeHandlers = new EnumMap<>(OrderType.class);
    private final Map<SubscriptionType, SettlementHandler> subscriptionHandlers = new EnumMap<>(SubscriptionType.class);

    public SettlementHandlerRegistry(EventRegistrationSettlementHandler eventRegistrationHandler,
                                     DonationSettlementHandler donationHandler,
                                     MembershipSettlementHandler membershipHandler,
                                     RecurringDonationSettlementHandler recurringDonationHandler,
                                     UnhandledKindSettlementHandler unhandledHandler) {
        for (OrderType type : OrderType.values()) {
            oneTimeHandlers.put(type, switch (type) {
                case EVENT_REGISTRATION -> eventRegistrationHandler;
                case DONATION -> donationHandler;
                case MEMBERSHIP, ORGANIZATION_MEMBERSHIP -> membershipHandler;
                case RECURRING_DONATION -> recurringDonationHandler;
                case UNKNOWN -> unhandledHandler;
            });
        }
        for (SubscriptionType type : SubscriptionType.values()) {
            subscriptionHandlers.put(type, switch (type) {
                case RECURRING_DONATION -> recurringDonationHandler;
                case MEMBERSHIP, ORGANIZATION_MEMBERSHIP -> membershipHandler;
                case UNKNOWN -> unhandledHandler;
            });
        }
    }

    public SettlementHandler forOrderType(OrderType orderType) {
        return oneTimeHandlers.get(orderType);
    }

    public SettlementHandler forSubscriptionType(SubscriptionType subscriptionType) {
        return subscriptionHandlers.get(subscriptionType);
    }
}
