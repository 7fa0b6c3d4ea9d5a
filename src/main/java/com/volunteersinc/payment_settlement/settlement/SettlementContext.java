package com.volunteersinc.payment_settlement.settlement;

import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.metadata.TransactionMetadata;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything a settlement handler needs, independent of whether the
 * confirmation came from a one-time transaction or a subscription.
 */
@Value
@Builder
public class SettlementContext {
    SettlementSource source;
    UUID recordId;
    /**
     * The business category code, as stored on the record. Used for logging.
     */
    String kind;
    UUID referenceId;
    UUID userId;
    BigDecimal amount;
    String transactionNumber;
    Instant settledAt;
    TransactionMetadata metadata;
    /**
     * Present only for subscription settlements.
     */
    PaymentSubscription subscription;

    public static SettlementContext forTransaction(PaymentTransaction transaction,
                                                   String transactionNumber, Instant settledAt) {
        return SettlementContext.builder()
            .source(SettlementSource.ONE_TIME)
            .recordId(transaction.getId())
            .kind(transaction.getOrderType().getCode())
            .referenceId(transaction.getReferenceId())
            .userId(transaction.getUserId())
            .amount(transaction.getAmount())
            .transactionNumber(transactionNumber)
            .settledAt(settledAt)
            .metadata(transaction.getMetadata() != null ? transaction.getMetadata() : TransactionMetadata.empty())
            .build();
    }

    public static SettlementContext forSubscription(PaymentSubscription subscription,
                                                    String transactionNumber, Instant settledAt) {
        return SettlementContext.builder()
            .source(SettlementSource.SUBSCRIPTION)
            .recordId(subscription.getId())
            .kind(subscription.getSubscriptionType().getCode())
            .referenceId(subscription.getReferenceId())
            .userId(subscription.getUserId())
            .amount(subscription.getAmount())
            .transactionNumber(transactionNumber)
            .settledAt(settledAt)
            .metadata(TransactionMetadata.empty())
            .subscription(subscription)
            .build();
    }

    public Optional<UUID> reference() {
        return Optional.ofNullable(referenceId);
    }

    public Optional<UUID> user() {
        return Optional.ofNullable(userId);
    }

    public Optional<PaymentSubscription> subscriptionRecord() {
        return Optional.ofNullable(subscription);
    }
}
