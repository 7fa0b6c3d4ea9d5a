package com.volunteersinc.payment_settlement.receipt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An issued receipt. Receipts are write-once.
 */
@Value
@Builder
public class Receipt {
    UUID id;
    String receiptNumber;
    ReceiptType receiptType;
    UUID transactionId;
    String transactionNumber;
    String customerName;
    String customerEmail;
    List<ReceiptLineItem> lineItems;
    BigDecimal subtotal;
    BigDecimal processingFee;
    BigDecimal totalAmount;
    String currency;
    String paymentMethod;
    String status;
    Instant issuedAt;
}
