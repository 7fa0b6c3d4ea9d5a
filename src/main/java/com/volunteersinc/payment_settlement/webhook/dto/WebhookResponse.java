package com.volunteersinc.payment_settlement.webhook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.volunteersinc.payment_settlement.webhook.WebhookResult;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {
    boolean success;
    String message;
    Boolean duplicate;

    public static WebhookResponse from(WebhookResult result) {
        return new WebhookResponse(true, result.getMessage(),
                result.getOutcome() == WebhookResult.Outcome.DUPLICATE ? Boolean.TRUE : null);
    }
}
