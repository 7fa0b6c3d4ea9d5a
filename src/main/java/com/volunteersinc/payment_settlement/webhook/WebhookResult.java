package com.volunteersinc.payment_settlement.webhook;

import com.volunteersinc.payment_settlement.payment.ConfirmationResult;
import lombok.Value;

/**
 * What handling one gateway callback amounted to. Every outcome is
 * acknowledged to the gateway with success; failures are raised instead.
 */
@Value
public class WebhookResult {

    public enum Outcome {
        DUPLICATE("duplicate"),
        ALREADY_PROCESSED("already_processed"),
        SETTLED("settled"),
        DECLINED("declined");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }

    Outcome outcome;
    String message;

    public static WebhookResult duplicate() {
        return new WebhookResult(Outcome.DUPLICATE, "Webhook already processed");
    }

    public static WebhookResult declined() {
        return new WebhookResult(Outcome.DECLINED, "Payment failure recorded");
    }

    public static WebhookResult from(ConfirmationResult confirmation) {
        if (confirmation.getKind() == ConfirmationResult.Kind.ALREADY_PROCESSED) {
            return new WebhookResult(Outcome.ALREADY_PROCESSED, "Already processed");
        }
        return new WebhookResult(Outcome.SETTLED, confirmation.getMessage());
    }
}
