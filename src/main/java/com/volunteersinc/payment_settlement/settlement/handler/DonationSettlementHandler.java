package com.volunteersinc.payment_settlement.settlement.handler;

import com.volunteersinc.payment_settlement.fulfillment.DonationStore;
import com.volunteersinc.payment_settlement.settlement.CauseProgressRecorder;
import com.volunteersinc.payment_settlement.settlement.DomainEffect;
import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import com.volunteersinc.payment_settlement.settlement.SettlementContext;
import com.volunteersinc.payment_settlement.settlement.SettlementHandler;
import com.volunteersinc.payment_settlement.transaction.metadata.DonationMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Marks a one-time donation paid and credits its cause.
 *
 * The cause is only credited when this call is the one that completed the
 * donation, so replays never count the same money twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DonationSettlementHandler implements SettlementHandler {

    private final DonationStore donationStore;
    private final CauseProgressRecorder causeProgressRecorder;

    @Override
    public DomainEffect settle(SettlementContext context) {
        if (context.reference().isEmpty()) {
            log.warn("Donation has no reference_id, skipping update: recordId={}", context.getRecordId());
            return DomainEffect.skipped("no donation reference");
        }

        UUID donationId = context.getReferenceId();
        boolean completed = donationStore.markCompleted(
            donationId, context.getTransactionNumber(), context.getSettledAt());

        if (!completed) {
            log.info("Donation already completed or missing, cause not credited: donationId={}", donationId);
            return DomainEffect.skipped("donation already completed");
        }

        log.info("Donation completed: donationId={}, amount={}", donationId, context.getAmount());

        Optional<UUID> causeId = donationStore.findCauseId(donationId).or(() -> causeFromMetadata(context));
        if (causeId.isEmpty()) {
            log.warn("Donation has no cause, nothing to credit: donationId={}", donationId);
            return DomainEffect.applied("donation " + donationId + " completed");
        }

        List<SecondaryFailure> failures = causeProgressRecorder.record(causeId.get(), context.getAmount())
            .map(List::of)
            .orElse(List.of());
        return DomainEffect.applied("donation " + donationId + " completed", failures);
    }

    private static Optional<UUID> causeFromMetadata(SettlementContext context) {
        if (context.getMetadata() instanceof DonationMetadata donation) {
            return donation.cause();
        }
        return Optional.empty();
    }
}
