package com.volunteersinc.payment_settlement.receipt;

import com.fasterxml.jackson.annotation.JsonValue;
import com.volunteersinc.payment_settlement.transaction.OrderType;

public enum ReceiptType {
    DONATION("donation"),
    SUBSCRIPTION("subscription"),
    EVENT("event"),
    MEMBERSHIP("membership");

    private final String code;

    ReceiptType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Receipt wording for a payment category. A first recurring-donation
     * charge is receipted as a subscription; categories without their own
     * receipt wording fall back to a donation receipt.
     */
    public static ReceiptType fromOrderType(OrderType orderType) {
        return switch (orderType) {
            case DONATION, UNKNOWN -> DONATION;
            case RECURRING_DONATION -> SUBSCRIPTION;
            case EVENT_REGISTRATION -> EVENT;
            case MEMBERSHIP, ORGANIZATION_MEMBERSHIP -> MEMBERSHIP;
        };
    }

    public static ReceiptType fromCode(String code) {
        for (ReceiptType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown receipt type: " + code);
    }
}
