package com.volunteersinc.payment_settlement.transaction;

import java.util.Optional;
import java.util.UUID;

/**
 * Parsing of loosely stored identifiers.
 *
 * Legacy rows carry reference ids as free text; anything that is not a
 * well-formed UUID is treated as absent rather than as an error.
 */
public final class ReferenceIds {

    private ReferenceIds() {
        // Utility class
    }

    public static Optional<UUID> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
