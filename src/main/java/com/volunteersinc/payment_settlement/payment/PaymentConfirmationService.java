package com.volunteersinc.payment_settlement.payment;

import com.volunteersinc.payment_settlement.observability.CorrelationContext;
import com.volunteersinc.payment_settlement.observability.SettlementMetrics;
import com.volunteersinc.payment_settlement.payment.exception.InvalidRequestException;
import com.volunteersinc.payment_settlement.payment.exception.RecordNotFoundException;
import com.volunteersinc.payment_settlement.payment.exception.SettlementFailedException;
import com.volunteersinc.payment_settlement.payment.exception.TransactionNotSettleableException;
import com.volunteersinc.payment_settlement.settlement.SettlementEngine;
import com.volunteersinc.payment_settlement.settlement.SettlementOutcome;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;
import com.volunteersinc.payment_settlement.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for gateway payment confirmations.
 *
 * A confirmation names exactly one ledger record. Transactions that are
 * already completed short-circuit without touching anything; failed or
 * refunded ones are rejected. Subscriptions never short-circuit, because
 * every confirmation of a subscription is a new charge.
 *
 * Metrics are tagged with the record kind ("transaction" or "subscription")
 * on every path, so success and error rates share one vocabulary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationService {

    static final String TRANSACTION_KIND = "transaction";
    static final String SUBSCRIPTION_KIND = "subscription";

    private final TransactionStore transactionStore;
    private final SubscriptionStore subscriptionStore;
    private final SettlementEngine settlementEngine;
    private final SettledTransactionCache settledTransactionCache;
    private final SettlementMetrics settlementMetrics;

    public ConfirmationResult confirm(String transactionId, String subscriptionId, String transactionNumber) {
        boolean hasTransaction = !isBlank(transactionId);
        boolean hasSubscription = !isBlank(subscriptionId);

        if (!hasTransaction && !hasSubscription) {
            throw new InvalidRequestException("transaction_id or subscription_id is required");
        }
        if (hasTransaction && hasSubscription) {
            throw new InvalidRequestException("Only one of transaction_id or subscription_id may be provided");
        }
        if (isBlank(transactionNumber)) {
            throw new InvalidRequestException("transaction_number is required");
        }

        return hasTransaction
            ? confirmTransaction(parseId(transactionId, "transaction_id"), transactionNumber.trim())
            : confirmSubscription(parseId(subscriptionId, "subscription_id"), transactionNumber.trim());
    }

    public ConfirmationResult confirmTransaction(UUID transactionId, String transactionNumber) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

        try {
            log.info("Processing one-time payment confirmation: transactionNumber={}", transactionNumber);

            if (settledTransactionCache.isKnownSettled(transactionId)) {
                return alreadyProcessed(transactionId);
            }

            PaymentTransaction transaction = transactionStore.findById(transactionId)
                .orElseThrow(() -> new RecordNotFoundException("Transaction not found"));

            if (transaction.isCompleted()) {
                settledTransactionCache.rememberSettled(transactionId);
                return alreadyProcessed(transactionId);
            }
            if (!transaction.getStatus().isSettleable()) {
                settlementMetrics.recordConfirmation(TRANSACTION_KIND, "rejected");
                log.warn("Confirmation for a transaction that cannot settle: status={}, orderType={}",
                        transaction.getStatus().getCode(), transaction.orderTypeLabel());
                throw new TransactionNotSettleableException(transaction.getStatus());
            }

            SettlementOutcome outcome = settle(TRANSACTION_KIND, () -> settlementEngine.settle(transaction, transactionNumber));
            settledTransactionCache.rememberSettled(transactionId);

            if (outcome.isAlreadySettled()) {
                return alreadyProcessed(transactionId);
            }

            long duration = System.currentTimeMillis() - startTime;
            settlementMetrics.recordConfirmation(TRANSACTION_KIND, "success");
            settlementMetrics.recordLatency(TRANSACTION_KIND, duration);
            log.info("Payment processed successfully: orderType={}, secondaryFailures={}, duration={}ms",
                    transaction.orderTypeLabel(), outcome.getSecondaryFailures().size(), duration);

            return ConfirmationResult.transactionSettled(transactionId, outcome);

        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    public ConfirmationResult confirmSubscription(UUID subscriptionId, String transactionNumber) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY, subscriptionId.toString());

        try {
            log.info("Processing subscription payment confirmation: transactionNumber={}", transactionNumber);

            PaymentSubscription subscription = subscriptionStore.findById(subscriptionId)
                .orElseThrow(() -> new RecordNotFoundException("Subscription not found"));

            SettlementOutcome outcome = settle(SUBSCRIPTION_KIND, () -> settlementEngine.settle(subscription, transactionNumber));

            long duration = System.currentTimeMillis() - startTime;
            settlementMetrics.recordConfirmation(SUBSCRIPTION_KIND, "success");
            settlementMetrics.recordLatency(SUBSCRIPTION_KIND, duration);
            log.info("Subscription payment processed successfully: subscriptionType={}, duration={}ms",
                    subscription.getSubscriptionType().getCode(), duration);

            return ConfirmationResult.subscriptionSettled(subscriptionId, outcome);

        } finally {
            MDC.remove(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY);
        }
    }

    private SettlementOutcome settle(String kind, Supplier<SettlementOutcome> settlement) {
        try {
            return settlement.get();
        } catch (RuntimeException e) {
            settlementMetrics.recordConfirmation(kind, "error");
            log.error("Payment processing failed: kind={}, error={}", kind, e.getMessage());
            throw new SettlementFailedException(e);
        }
    }

    private ConfirmationResult alreadyProcessed(UUID transactionId) {
        settlementMetrics.recordAlreadyProcessed();
        log.info("Transaction already completed, skipping");
        return ConfirmationResult.alreadyProcessed(transactionId);
    }

    private static UUID parseId(String raw, String field) {
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(field + " must be a valid UUID");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
