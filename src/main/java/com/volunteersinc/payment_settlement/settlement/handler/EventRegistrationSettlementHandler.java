package com.volunteersinc.payment_settlement.settlement.handler;

import com.volunteersinc.payment_settlement.fulfillment.EventRegistrationStore;
import com.volunteersinc.payment_settlement.settlement.DomainEffect;
import com.volunteersinc.payment_settlement.settlement.SettlementContext;
import com.volunteersinc.payment_settlement.settlement.SettlementHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Confirms the event registration a payment was made for.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventRegistrationSettlementHandler implements SettlementHandler {

    private final EventRegistrationStore registrationStore;

    @Override
    public DomainEffect settle(SettlementContext context) {
        if (context.reference().isEmpty()) {
            log.warn("Event registration has no reference_id, skipping update: recordId={}", context.getRecordId());
            return DomainEffect.skipped("no registration reference");
        }

        UUID registrationId = context.getReferenceId();
        boolean updated = registrationStore.markRegistered(
            registrationId, context.getTransactionNumber(), context.getAmount());

        if (!updated) {
            log.warn("Event registration not found, nothing updated: registrationId={}", registrationId);
            return DomainEffect.skipped("registration not found");
        }

        log.info("Event registration confirmed: registrationId={}, amountPaid={}",
                registrationId, context.getAmount());
        return DomainEffect.applied("event registration " + registrationId + " registered");
    }
}
