package com.volunteersinc.payment_settlement.receipt;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Gateway processing fee shown on receipts: a percentage of the amount
 * with a fixed floor, rounded to cents half-up.
 */
@Component
public class ProcessingFeeCalculator {

    private final BigDecimal minimumFee;
    private final BigDecimal feeRate;

    public ProcessingFeeCalculator(@Value("${settlement.receipt.minimum-fee:135}") BigDecimal minimumFee,
                                   @Value("${settlement.receipt.fee-rate:0.03}") BigDecimal feeRate) {
        this.minimumFee = minimumFee;
        this.feeRate = feeRate;
    }

    public BigDecimal calculateFee(BigDecimal amount) {
        BigDecimal percentage = amount.multiply(feeRate);
        return percentage.max(minimumFee).setScale(2, RoundingMode.HALF_UP);
    }
}
