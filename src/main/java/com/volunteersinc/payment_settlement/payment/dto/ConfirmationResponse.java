package com.volunteersinc.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.volunteersinc.payment_settlement.payment.ConfirmationResult;
import lombok.Value;

import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfirmationResponse {
    boolean success;
    String message;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    public static ConfirmationResponse from(ConfirmationResult result) {
        return switch (result.getKind()) {
            case ALREADY_PROCESSED -> new ConfirmationResponse(true, result.getMessage(), null, null);
            case TRANSACTION_SETTLED -> new ConfirmationResponse(true, result.getMessage(), result.getRecordId(), null);
            case SUBSCRIPTION_SETTLED -> new ConfirmationResponse(true, result.getMessage(), null, result.getRecordId());
        };
    }
}
