package com.volunteersinc.payment_settlement.receipt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProcessingFeeCalculatorTest {

    private final ProcessingFeeCalculator calculator =
        new ProcessingFeeCalculator(new BigDecimal("135"), new BigDecimal("0.03"));

    @Test
    @DisplayName("Small amounts pay the minimum fee")
    void minimumFee() {
        assertEquals(new BigDecimal("135.00"), calculator.calculateFee(new BigDecimal("1000")));
    }

    @Test
    @DisplayName("Large amounts pay the percentage")
    void percentageFee() {
        assertEquals(new BigDecimal("300.00"), calculator.calculateFee(new BigDecimal("10000")));
    }

    @Test
    @DisplayName("The percentage is rounded half-up to cents")
    void roundsHalfUp() {
        assertEquals(new BigDecimal("150.02"), calculator.calculateFee(new BigDecimal("5000.50")));
    }

    @Test
    @DisplayName("The switch-over point pays exactly the minimum")
    void breakEven() {
        assertEquals(new BigDecimal("135.00"), calculator.calculateFee(new BigDecimal("4500")));
    }
}
