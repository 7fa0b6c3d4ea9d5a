package com.volunteersinc.payment_settlement.receipt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Everything needed to issue a receipt for a settled transaction.
 */
@Value
@Builder
public class ReceiptRequest {
    UUID transactionId;
    String transactionNumber;
    String customerName;
    String customerEmail;
    ReceiptType receiptType;
    List<ReceiptLineItem> lineItems;
    BigDecimal subtotal;
    BigDecimal processingFee;
    BigDecimal totalAmount;
    String currency;
    String paymentMethod;
}
