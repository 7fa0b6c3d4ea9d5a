package com.volunteersinc.payment_settlement.support;

import com.volunteersinc.payment_settlement.receipt.Receipt;
import com.volunteersinc.payment_settlement.receipt.ReceiptIssuer;
import com.volunteersinc.payment_settlement.receipt.ReceiptRequest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class InMemoryReceiptIssuer implements ReceiptIssuer {

    private final List<Receipt> receipts = new ArrayList<>();
    private RuntimeException failure;

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<Receipt> issued() {
        return receipts;
    }

    @Override
    public Optional<Receipt> issue(ReceiptRequest request) {
        if (failure != null) {
            throw failure;
        }
        boolean exists = receipts.stream().anyMatch(receipt ->
            receipt.getTransactionId().equals(request.getTransactionId())
                && receipt.getTransactionNumber().equals(request.getTransactionNumber()));
        if (exists) {
            return Optional.empty();
        }
        Receipt receipt = Receipt.builder()
            .id(UUID.randomUUID())
            .receiptNumber("RCP-TEST-" + (receipts.size() + 1))
            .receiptType(request.getReceiptType())
            .transactionId(request.getTransactionId())
            .transactionNumber(request.getTransactionNumber())
            .customerName(request.getCustomerName())
            .customerEmail(request.getCustomerEmail())
            .lineItems(request.getLineItems())
            .subtotal(request.getSubtotal())
            .processingFee(request.getProcessingFee())
            .totalAmount(request.getTotalAmount())
            .currency(request.getCurrency())
            .paymentMethod(request.getPaymentMethod())
            .status("generated")
            .issuedAt(Instant.now())
            .build();
        receipts.add(receipt);
        return Optional.of(receipt);
    }

    @Override
    public Optional<Receipt> findByReceiptNumber(String receiptNumber) {
        return receipts.stream().filter(receipt -> receipt.getReceiptNumber().equals(receiptNumber)).findFirst();
    }

    @Override
    public List<Receipt> findByCustomerEmail(String customerEmail, int limit) {
        return receipts.stream()
            .filter(receipt -> receipt.getCustomerEmail().equals(customerEmail))
            .sorted(Comparator.comparing(Receipt::getIssuedAt).reversed())
            .limit(limit)
            .toList();
    }
}
