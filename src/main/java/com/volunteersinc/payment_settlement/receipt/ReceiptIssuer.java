package com.volunteersinc.payment_settlement.receipt;

import java.util.List;
import java.util.Optional;

/**
 * Receipt persistence.
 */
public interface ReceiptIssuer {

    /**
     * Issues a receipt for a transaction.
     *
     * @return the new receipt, or empty if one already exists for the same
     *         transaction and transaction number
     */
    Optional<Receipt> issue(ReceiptRequest request);

    Optional<Receipt> findByReceiptNumber(String receiptNumber);

    /**
     * Most recent receipts first.
     */
    List<Receipt> findByCustomerEmail(String customerEmail, int limit);
}
