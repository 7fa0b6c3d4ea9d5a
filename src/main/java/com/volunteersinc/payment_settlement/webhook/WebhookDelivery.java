package com.volunteersinc.payment_settlement.webhook;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One gateway callback as it is written to the audit trail.
 */
@Value
@Builder
public class WebhookDelivery {
    WebhookEventType eventType;
    String transactionNumber;
    Map<String, Object> payload;
    Map<String, String> headers;
}
