package com.volunteersinc.payment_settlement.transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Status of a recurring billing agreement.
 * A successful billing confirmation always leaves the subscription ACTIVE.
 */
@Slf4j
public enum SubscriptionStatus {
    PENDING("pending"),
    ACTIVE("active"),
    CANCELLED("cancelled"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String code;

    SubscriptionStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SubscriptionStatus fromCode(String code) {
        for (SubscriptionStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        log.warn("Unrecognized subscription status: {}", code);
        return UNKNOWN;
    }
}
