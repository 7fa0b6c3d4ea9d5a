package com.volunteersinc.payment_settlement.transaction;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Billing cadence shared by subscriptions and membership expiry.
 *
 * Month and year steps are calendar steps: Jan 31 + MONTHLY is Feb 28/29,
 * matching LocalDate.plusMonths.
 */
public enum BillingFrequency {
    DAILY("daily") {
        @Override
        public LocalDate advance(LocalDate from) {
            return from.plusDays(1);
        }
    },
    WEEKLY("weekly") {
        @Override
        public LocalDate advance(LocalDate from) {
            return from.plusDays(7);
        }
    },
    MONTHLY("monthly") {
        @Override
        public LocalDate advance(LocalDate from) {
            return from.plusMonths(1);
        }
    },
    QUARTERLY("quarterly") {
        @Override
        public LocalDate advance(LocalDate from) {
            return from.plusMonths(3);
        }
    },
    ANNUALLY("annually") {
        @Override
        public LocalDate advance(LocalDate from) {
            return from.plusYears(1);
        }
    };

    private final String code;

    BillingFrequency(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Returns the next billing date after {@code from}.
     */
    public abstract LocalDate advance(LocalDate from);

    /**
     * Parses a stored frequency code. Blank or unrecognised codes are empty
     * so callers can fall back to their own default.
     */
    public static Optional<BillingFrequency> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        for (BillingFrequency frequency : values()) {
            if (frequency.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(frequency);
            }
        }
        return Optional.empty();
    }
}
