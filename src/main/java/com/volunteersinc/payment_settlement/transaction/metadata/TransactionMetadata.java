package com.volunteersinc.payment_settlement.transaction.metadata;

/**
 * Typed view of the free-form metadata stored on a payment transaction.
 *
 * Parsed once at the store boundary by {@link TransactionMetadataParser};
 * handlers only ever see one of the concrete variants.
 */
public interface TransactionMetadata {

    static TransactionMetadata empty() {
        return EmptyMetadata.INSTANCE;
    }
}
