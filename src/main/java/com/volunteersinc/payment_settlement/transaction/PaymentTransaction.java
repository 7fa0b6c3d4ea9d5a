package com.volunteersinc.payment_settlement.transaction;

import com.volunteersinc.payment_settlement.transaction.metadata.TransactionMetadata;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One-time payment attempt as read from the ledger.
 *
 * Instances are snapshots: settling a transaction goes through
 * {@link TransactionStore#markCompleted}, never through this object.
 */
@Value
@Builder(toBuilder = true)
public class PaymentTransaction {
    UUID id;
    String orderId;
    OrderType orderType;
    /**
     * order_type exactly as stored, kept for display when the type is unknown.
     */
    String orderTypeCode;
    /**
     * Domain record this payment pays for (donation, registration, ...).
     * Null when absent or when the stored value was not a UUID.
     */
    UUID referenceId;
    UUID userId;
    BigDecimal amount;
    String customerEmail;
    String customerName;
    String description;
    TransactionStatus status;
    TransactionMetadata metadata;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    String transactionNumber;

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }

    public String orderTypeLabel() {
        if (orderType == OrderType.UNKNOWN && orderTypeCode != null && !orderTypeCode.isBlank()) {
            return orderTypeCode;
        }
        return orderType.getCode();
    }

    public Optional<UUID> reference() {
        return Optional.ofNullable(referenceId);
    }

    public Optional<UUID> user() {
        return Optional.ofNullable(userId);
    }
}
