package com.volunteersinc.payment_settlement.receipt;

import com.volunteersinc.payment_settlement.settlement.SecondaryEffect;
import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Issues the receipt for a settled one-time transaction.
 *
 * A receipt never blocks settlement. Transactions without a transaction
 * number or customer email get no receipt, and issuer failures come back
 * as a {@link SecondaryFailure}.
 */
@Service
@Slf4j
public class ReceiptOrchestrator {

    static final String DEFAULT_CUSTOMER_NAME = "Customer";
    static final String PAYMENT_METHOD = "Credit Card";

    private final ReceiptIssuer receiptIssuer;
    private final ProcessingFeeCalculator feeCalculator;
    private final String currency;

    public ReceiptOrchestrator(ReceiptIssuer receiptIssuer,
                               ProcessingFeeCalculator feeCalculator,
                               @Value("${settlement.currency:JMD}") String currency) {
        this.receiptIssuer = receiptIssuer;
        this.feeCalculator = feeCalculator;
        this.currency = currency;
    }

    public Optional<SecondaryFailure> issueFor(PaymentTransaction transaction, String transactionNumber) {
        if (isBlank(transactionNumber) || isBlank(transaction.getCustomerEmail())) {
            log.warn("Cannot generate receipt, missing transaction_number or customer_email: transactionId={}",
                    transaction.getId());
            return Optional.empty();
        }

        try {
            Optional<Receipt> receipt = receiptIssuer.issue(buildRequest(transaction, transactionNumber));
            if (receipt.isPresent()) {
                log.info("Receipt generated: receiptNumber={}, receiptType={}",
                        receipt.get().getReceiptNumber(), receipt.get().getReceiptType());
            } else {
                log.info("Receipt already issued for this charge: transactionId={}, transactionNumber={}",
                        transaction.getId(), transactionNumber);
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Receipt generation failed, payment stays settled: transactionId={}, error={}",
                    transaction.getId(), e.getMessage());
            return Optional.of(SecondaryFailure.of(SecondaryEffect.RECEIPT, e));
        }
    }

    ReceiptRequest buildRequest(PaymentTransaction transaction, String transactionNumber) {
        BigDecimal amount = transaction.getAmount();
        String description = isBlank(transaction.getDescription())
            ? transaction.orderTypeLabel() + " payment"
            : transaction.getDescription();

        return ReceiptRequest.builder()
            .transactionId(transaction.getId())
            .transactionNumber(transactionNumber)
            .customerName(isBlank(transaction.getCustomerName()) ? DEFAULT_CUSTOMER_NAME : transaction.getCustomerName())
            .customerEmail(transaction.getCustomerEmail())
            .receiptType(ReceiptType.fromOrderType(transaction.getOrderType()))
            .lineItems(List.of(ReceiptLineItem.single(description, amount)))
            .subtotal(amount)
            .processingFee(feeCalculator.calculateFee(amount))
            .totalAmount(amount)
            .currency(currency)
            .paymentMethod(PAYMENT_METHOD)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
