package com.volunteersinc.payment_settlement.transaction.metadata;

/**
 * No usable metadata: absent, malformed, or not meaningful for the order type.
 */
public final class EmptyMetadata implements TransactionMetadata {

    static final EmptyMetadata INSTANCE = new EmptyMetadata();

    private EmptyMetadata() {
    }

    @Override
    public String toString() {
        return "EmptyMetadata";
    }
}
