package com.volunteersinc.payment_settlement.settlement.handler;

import com.volunteersinc.payment_settlement.fulfillment.DonationStore;
import com.volunteersinc.payment_settlement.fulfillment.NewDonation;
import com.volunteersinc.payment_settlement.fulfillment.RecurringDonation;
import com.volunteersinc.payment_settlement.fulfillment.RecurringDonationStore;
import com.volunteersinc.payment_settlement.settlement.CauseProgressRecorder;
import com.volunteersinc.payment_settlement.settlement.DomainEffect;
import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import com.volunteersinc.payment_settlement.settlement.SettlementContext;
import com.volunteersinc.payment_settlement.settlement.SettlementHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Records one charge of a recurring donation.
 *
 * Used for the first charge (one-time transaction path) and for every
 * renewal (subscription path). Each charge becomes its own completed
 * donation row; the cause is credited only when that row is new.
 */
@Component
@Slf4j
public class RecurringDonationSettlementHandler implements SettlementHandler {

    private final RecurringDonationStore recurringDonationStore;
    private final DonationStore donationStore;
    private final CauseProgressRecorder causeProgressRecorder;
    private final String currency;

    public RecurringDonationSettlementHandler(RecurringDonationStore recurringDonationStore,
                                              DonationStore donationStore,
                                              CauseProgressRecorder causeProgressRecorder,
                                              @Value("${settlement.currency:JMD}") String currency) {
        this.recurringDonationStore = recurringDonationStore;
        this.donationStore = donationStore;
        this.causeProgressRecorder = causeProgressRecorder;
        this.currency = currency;
    }

    @Override
    public DomainEffect settle(SettlementContext context) {
        if (context.reference().isEmpty()) {
            log.warn("Recurring donation has no reference_id, skipping update: recordId={}, source={}",
                    context.getRecordId(), context.getSource());
            return DomainEffect.skipped("no recurring donation reference");
        }

        UUID recurringDonationId = context.getReferenceId();
        recurringDonationStore.activate(recurringDonationId);

        RecurringDonation recurringDonation = recurringDonationStore.findById(recurringDonationId)
            .orElseThrow(() -> new IllegalStateException("Recurring donation not found: " + recurringDonationId));

        NewDonation donation = NewDonation.builder()
            .causeId(recurringDonation.getCauseId())
            .userId(context.getUserId())
            .amount(context.getAmount())
            .currency(currency)
            .anonymous(recurringDonation.isAnonymous())
            .recurringDonationId(recurringDonationId)
            .transactionNumber(context.getTransactionNumber())
            .completedAt(context.getSettledAt())
            .build();

        if (!donationStore.insertCompleted(donation)) {
            log.info("Donation for this charge already recorded, cause not credited: recurringDonationId={}, " +
                    "transactionNumber={}", recurringDonationId, context.getTransactionNumber());
            return DomainEffect.skipped("charge already recorded");
        }

        log.info("Recurring donation charge recorded: recurringDonationId={}, amount={}",
                recurringDonationId, context.getAmount());

        List<SecondaryFailure> failures = new ArrayList<>();
        if (recurringDonation.getCauseId() != null) {
            causeProgressRecorder.record(recurringDonation.getCauseId(), context.getAmount())
                .ifPresent(failures::add);
        } else {
            log.warn("Recurring donation has no cause, nothing to credit: recurringDonationId={}",
                    recurringDonationId);
        }
        return DomainEffect.applied("recurring donation " + recurringDonationId + " charged", failures);
    }
}
