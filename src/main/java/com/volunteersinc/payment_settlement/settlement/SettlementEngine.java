package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.observability.SettlementMetrics;
import com.volunteersinc.payment_settlement.receipt.ReceiptOrchestrator;
import com.volunteersinc.payment_settlement.settlement.exception.DomainMutationFailureException;
import com.volunteersinc.payment_settlement.settlement.exception.PrimaryLedgerFailureException;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;
import com.volunteersinc.payment_settlement.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a confirmed payment into its ledger and domain updates.
 *
 * Steps run in a fixed order, each committing on its own:
 * 1. Ledger update. Failure aborts with {@link PrimaryLedgerFailureException}
 *    and nothing else runs. For transactions the update is conditional, so
 *    a delivery that loses a race returns ALREADY_SETTLED untouched.
 * 2. Category handler. Failure means the ledger says completed while the
 *    domain records do not; a fulfillment retry event is queued and
 *    {@link DomainMutationFailureException} is thrown.
 * 3. Receipt (one-time transactions only). Failure is tolerated.
 *
 * No surrounding database transaction: the ledger update stays committed
 * when a later step fails.
 */
@Service
@Slf4j
public class SettlementEngine {

    private final TransactionStore transactionStore;
    private final SubscriptionStore subscriptionStore;
    private final SettlementHandlerRegistry handlerRegistry;
    private final ReceiptOrchestrator receiptOrchestrator;
    private final FulfillmentFailureRecorder failureRecorder;
    private final SettlementMetrics settlementMetrics;
    private final Clock clock;

    public SettlementEngine(TransactionStore transactionStore,
                            SubscriptionStore subscriptionStore,
                            SettlementHandlerRegistry handlerRegistry,
                            ReceiptOrchestrator receiptOrchestrator,
                            FulfillmentFailureRecorder failureRecorder,
                            SettlementMetrics settlementMetrics,
                            Clock clock) {
        this.transactionStore = transactionStore;
        this.subscriptionStore = subscriptionStore;
        this.handlerRegistry = handlerRegistry;
        this.receiptOrchestrator = receiptOrchestrator;
        this.failureRecorder = failureRecorder;
        this.settlementMetrics = settlementMetrics;
        this.clock = clock;
    }

    public SettlementOutcome settle(PaymentTransaction transaction, String transactionNumber) {
        UUID transactionId = transaction.getId();
        Instant settledAt = clock.instant();

        log.info("Settling transaction: orderType={}, referenceId={}, userId={}",
                transaction.orderTypeLabel(), transaction.getReferenceId(), transaction.getUserId());

        boolean transitioned;
        try {
            transitioned = transactionStore.markCompleted(transactionId, transactionNumber, settledAt);
        } catch (RuntimeException e) {
            log.error("Transaction update failed: transactionId={}, error={}", transactionId, e.getMessage());
            throw new PrimaryLedgerFailureException(transactionId,
                    "Transaction update failed: " + e.getMessage(), e);
        }

        if (!transitioned) {
            log.info("Transaction no longer pending, skipping fulfillment: transactionId={}", transactionId);
            return SettlementOutcome.alreadySettled(transactionId);
        }

        SettlementContext context = SettlementContext.forTransaction(transaction, transactionNumber, settledAt);
        DomainEffect effect = dispatch(handlerRegistry.forOrderType(transaction.getOrderType()), context, true);

        List<SecondaryFailure> failures = new ArrayList<>(effect.getSecondaryFailures());
        receiptOrchestrator.issueFor(transaction, transactionNumber).ifPresent(failures::add);

        return complete(context, effect, failures);
    }

    public SettlementOutcome settle(PaymentSubscription subscription, String transactionNumber) {
        UUID subscriptionId = subscription.getId();
        Instant settledAt = clock.instant();
        LocalDate billedOn = LocalDate.now(clock);

        log.info("Settling subscription payment: subscriptionType={}, referenceId={}, userId={}",
                subscription.getSubscriptionType().getCode(), subscription.getReferenceId(), subscription.getUserId());

        boolean updated;
        try {
            updated = subscriptionStore.markBilled(subscriptionId, transactionNumber, billedOn, settledAt);
        } catch (RuntimeException e) {
            log.error("Subscription update failed: subscriptionId={}, error={}", subscriptionId, e.getMessage());
            throw new PrimaryLedgerFailureException(subscriptionId,
                    "Subscription update failed: " + e.getMessage(), e);
        }
        if (!updated) {
            throw new PrimaryLedgerFailureException(subscriptionId,
                    "Subscription update failed: no subscription " + subscriptionId);
        }

        SettlementContext context = SettlementContext.forSubscription(subscription, transactionNumber, settledAt);
        DomainEffect effect = dispatch(
                handlerRegistry.forSubscriptionType(subscription.getSubscriptionType()), context, true);

        return complete(context, effect, effect.getSecondaryFailures());
    }

    /**
     * Re-runs the domain side of a transaction settlement whose fulfillment
     * failed earlier. The ledger is not touched. Handler failures propagate
     * without queueing another retry event.
     */
    public SettlementOutcome refulfill(PaymentTransaction transaction, String transactionNumber) {
        if (!transaction.isCompleted()) {
            throw new IllegalStateException("Cannot refulfill transaction that is not completed: "
                    + transaction.getId());
        }

        log.info("Retrying fulfillment of transaction: orderType={}", transaction.getOrderType().getCode());

        SettlementContext context = SettlementContext.forTransaction(transaction, transactionNumber, clock.instant());
        DomainEffect effect = dispatch(handlerRegistry.forOrderType(transaction.getOrderType()), context, false);

        List<SecondaryFailure> failures = new ArrayList<>(effect.getSecondaryFailures());
        receiptOrchestrator.issueFor(transaction, transactionNumber).ifPresent(failures::add);

        return complete(context, effect, failures);
    }

    public SettlementOutcome refulfill(PaymentSubscription subscription, String transactionNumber) {
        log.info("Retrying fulfillment of subscription payment: subscriptionType={}",
                subscription.getSubscriptionType().getCode());

        SettlementContext context = SettlementContext.forSubscription(subscription, transactionNumber, clock.instant());
        DomainEffect effect = dispatch(
                handlerRegistry.forSubscriptionType(subscription.getSubscriptionType()), context, false);

        return complete(context, effect, effect.getSecondaryFailures());
    }

    private DomainEffect dispatch(SettlementHandler handler, SettlementContext context, boolean queueRetry) {
        try {
            return handler.settle(context);
        } catch (RuntimeException e) {
            log.error("Fulfillment failed after ledger update: source={}, recordId={}, kind={}, error={}",
                    context.getSource(), context.getRecordId(), context.getKind(), e.getMessage());

            DomainMutationFailureException failure =
                    new DomainMutationFailureException(context.getRecordId(), context.getKind(), e);
            if (queueRetry) {
                try {
                    failureRecorder.record(context, e);
                } catch (RuntimeException recordError) {
                    log.error("Could not queue fulfillment retry, manual repair needed: recordId={}, error={}",
                            context.getRecordId(), recordError.getMessage());
                    failure.addSuppressed(recordError);
                }
            }
            throw failure;
        }
    }

    private SettlementOutcome complete(SettlementContext context, DomainEffect effect,
                                       List<SecondaryFailure> failures) {
        for (SecondaryFailure failure : failures) {
            settlementMetrics.recordSecondaryFailure(failure.getEffect());
        }

        log.info("Settlement complete: source={}, recordId={}, effect={}, secondaryFailures={}",
                context.getSource(), context.getRecordId(), effect.getDescription(), failures.size());

        return SettlementOutcome.settled(context.getSource(), context.getRecordId(), effect, failures);
    }
}
