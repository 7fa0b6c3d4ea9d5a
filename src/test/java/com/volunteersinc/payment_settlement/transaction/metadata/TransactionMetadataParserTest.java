package com.volunteersinc.payment_settlement.transaction.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volunteersinc.payment_settlement.transaction.BillingFrequency;
import com.volunteersinc.payment_settlement.transaction.OrderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionMetadataParserTest {

    private final TransactionMetadataParser parser = new TransactionMetadataParser(new ObjectMapper());

    @Test
    @DisplayName("Membership metadata carries the subscription link and frequency")
    void parsesMembership() {
        UUID subscriptionId = UUID.randomUUID();
        TransactionMetadata metadata = parser.parse(OrderType.MEMBERSHIP,
            "{\"payment_subscriptions_id\":\"" + subscriptionId + "\",\"frequency\":\"annually\",\"plan\":\"gold\"}");

        MembershipMetadata membership = assertInstanceOf(MembershipMetadata.class, metadata);
        assertEquals(subscriptionId, membership.getSubscriptionRef());
        assertEquals(BillingFrequency.ANNUALLY, membership.getFrequency());
    }

    @Test
    @DisplayName("Bad values inside membership metadata are dropped field by field")
    void dropsBadMembershipFields() {
        TransactionMetadata metadata = parser.parse(OrderType.ORGANIZATION_MEMBERSHIP,
            "{\"payment_subscriptions_id\":\"sub-42\",\"frequency\":\"monthly\"}");

        MembershipMetadata membership = assertInstanceOf(MembershipMetadata.class, metadata);
        assertNull(membership.getSubscriptionRef());
        assertEquals(BillingFrequency.MONTHLY, membership.getFrequency());
    }

    @Test
    @DisplayName("Donation metadata carries the cause")
    void parsesDonation() {
        UUID causeId = UUID.randomUUID();
        TransactionMetadata metadata = parser.parse(OrderType.DONATION, "{\"cause_id\":\"" + causeId + "\"}");

        assertEquals(causeId, assertInstanceOf(DonationMetadata.class, metadata).getCauseId());
    }

    @Test
    @DisplayName("Malformed or irrelevant metadata is empty")
    void degradesToEmpty() {
        assertSame(TransactionMetadata.empty(), parser.parse(OrderType.MEMBERSHIP, "{not json"));
        assertSame(TransactionMetadata.empty(), parser.parse(OrderType.MEMBERSHIP, "[1,2]"));
        assertSame(TransactionMetadata.empty(), parser.parse(OrderType.MEMBERSHIP, "{}"));
        assertSame(TransactionMetadata.empty(), parser.parse(OrderType.DONATION, null));
        assertSame(TransactionMetadata.empty(),
            parser.parse(OrderType.EVENT_REGISTRATION, "{\"cause_id\":\"" + UUID.randomUUID() + "\"}"));
    }
}
