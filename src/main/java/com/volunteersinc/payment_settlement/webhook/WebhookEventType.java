package com.volunteersinc.payment_settlement.webhook;

public enum WebhookEventType {
    ONE_TIME_PAYMENT("one_time_payment"),
    SUBSCRIPTION_PAYMENT("subscription_payment");

    private final String code;

    WebhookEventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
