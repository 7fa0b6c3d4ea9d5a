package com.volunteersinc.payment_settlement.settlement;

/**
 * Side effects whose failure is tolerated after a payment settles.
 */
public enum SecondaryEffect {
    CAUSE_AGGREGATE("cause_aggregate"),
    RECEIPT("receipt"),
    PUSH_DELIVERY("push_delivery");

    private final String tag;

    SecondaryEffect(String tag) {
        this.tag = tag;
    }

    /**
     * Value used as the metrics tag.
     */
    public String getTag() {
        return tag;
    }
}
