package com.volunteersinc.payment_settlement.payment;

import com.volunteersinc.payment_settlement.settlement.SettlementOutcome;
import lombok.Value;

import java.util.UUID;

/**
 * What handling one confirmation amounted to.
 */
@Value
public class ConfirmationResult {

    public enum Kind {
        ALREADY_PROCESSED("Transaction already processed"),
        TRANSACTION_SETTLED("Payment processed successfully"),
        SUBSCRIPTION_SETTLED("Subscription payment processed successfully");

        private final String message;

        Kind(String message) {
            this.message = message;
        }
    }

    Kind kind;
    UUID recordId;
    /**
     * Null when the confirmation short-circuited before settlement.
     */
    SettlementOutcome outcome;

    public String getMessage() {
        return kind.message;
    }

    public static ConfirmationResult alreadyProcessed(UUID transactionId) {
        return new ConfirmationResult(Kind.ALREADY_PROCESSED, transactionId, null);
    }

    public static ConfirmationResult transactionSettled(UUID transactionId, SettlementOutcome outcome) {
        return new ConfirmationResult(Kind.TRANSACTION_SETTLED, transactionId, outcome);
    }

    public static ConfirmationResult subscriptionSettled(UUID subscriptionId, SettlementOutcome outcome) {
        return new ConfirmationResult(Kind.SUBSCRIPTION_SETTLED, subscriptionId, outcome);
    }
}
