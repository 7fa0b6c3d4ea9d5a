package com.volunteersinc.payment_settlement.transaction;

/**
 * Business category of a one-time payment.
 *
 * Stored as a lowercase code in payment_transactions.order_type.
 * Codes this service does not recognise map to UNKNOWN instead of failing,
 * because the ledger row must still settle.
 */
public enum OrderType {
    EVENT_REGISTRATION("event_registration"),
    DONATION("donation"),
    MEMBERSHIP("membership"),
    ORGANIZATION_MEMBERSHIP("organization_membership"),
    RECURRING_DONATION("recurring_donation"),
    UNKNOWN("unknown");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static OrderType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (OrderType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
