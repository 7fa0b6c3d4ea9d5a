package com.volunteersinc.payment_settlement.transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Status of a one-time payment transaction.
 *
 * Only PENDING can be settled. Every other status is terminal for this
 * service: COMPLETED is what the confirmation short-circuit checks, and
 * FAILED and REFUNDED are written by the webhook and the refund flow.
 */
@Slf4j
public enum TransactionStatus {
    /**
     * Token issued, waiting for the gateway confirmation.
     */
    PENDING("pending"),

    /**
     * Confirmation settled.
     */
    COMPLETED("completed"),

    /**
     * Gateway reported a decline.
     */
    FAILED("failed"),

    /**
     * Charge returned to the payer after settlement.
     */
    REFUNDED("refunded"),

    /**
     * Stored status this service does not know. Never settled.
     */
    UNKNOWN("unknown");

    private final String code;

    TransactionStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isSettleable() {
        return this == PENDING;
    }

    public static TransactionStatus fromCode(String code) {
        for (TransactionStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        log.warn("Unrecognized transaction status: {}", code);
        return UNKNOWN;
    }
}
