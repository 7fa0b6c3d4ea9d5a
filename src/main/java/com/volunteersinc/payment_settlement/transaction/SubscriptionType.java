package com.volunteersinc.payment_settlement.transaction;

public enum SubscriptionType {
    RECURRING_DONATION("recurring_donation"),
    MEMBERSHIP("membership"),
    ORGANIZATION_MEMBERSHIP("organization_membership"),
    UNKNOWN("unknown");

    private final String code;

    SubscriptionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SubscriptionType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (SubscriptionType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
