package com.volunteersinc.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Gateway confirmation as posted by the payment pages and the pending
 * payment checker. Ids are kept as text so malformed values reach the
 * router's own validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmPaymentRequest {

    @JsonProperty("transaction_id")
    private String transactionId;

    @JsonProperty("subscription_id")
    private String subscriptionId;

    @JsonProperty("transaction_number")
    private String transactionNumber;
}
