package com.volunteersinc.payment_settlement.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BillingFrequencyTest {

    private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);

    @Test
    @DisplayName("Advances by the calendar step of each frequency")
    void advances() {
        assertEquals(LocalDate.of(2024, 2, 1), BillingFrequency.DAILY.advance(JAN_31));
        assertEquals(LocalDate.of(2024, 2, 7), BillingFrequency.WEEKLY.advance(JAN_31));
        assertEquals(LocalDate.of(2024, 2, 29), BillingFrequency.MONTHLY.advance(JAN_31));
        assertEquals(LocalDate.of(2024, 4, 30), BillingFrequency.QUARTERLY.advance(JAN_31));
        assertEquals(LocalDate.of(2025, 1, 31), BillingFrequency.ANNUALLY.advance(JAN_31));
    }

    @Test
    @DisplayName("Annual renewal of a leap day lands on Feb 28")
    void leapDay() {
        assertEquals(LocalDate.of(2025, 2, 28), BillingFrequency.ANNUALLY.advance(LocalDate.of(2024, 2, 29)));
    }

    @Test
    @DisplayName("Parses codes case-insensitively and leaves unknown codes empty")
    void parsesCodes() {
        assertEquals(Optional.of(BillingFrequency.QUARTERLY), BillingFrequency.fromCode(" Quarterly "));
        assertEquals(Optional.empty(), BillingFrequency.fromCode("fortnightly"));
        assertEquals(Optional.empty(), BillingFrequency.fromCode(null));
    }
}
