package com.volunteersinc.payment_settlement.receipt;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Human-facing receipt numbers: {@code RCP-<year>-<last 6 epoch-millis digits><3 random digits>}.
 *
 * Not guaranteed unique; the receipts table enforces uniqueness and the
 * issuer retries on collision.
 */
@Component
public class ReceiptNumberGenerator {

    private final Clock clock;

    public ReceiptNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        int year = LocalDate.now(clock).getYear();
        long millis = clock.millis();
        String sequence = String.format("%06d", millis % 1_000_000);
        int random = ThreadLocalRandom.current().nextInt(1000);
        return String.format("RCP-%d-%s%03d", year, sequence, random);
    }
}
