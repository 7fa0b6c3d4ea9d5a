package com.volunteersinc.payment_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * What a settlement handler did to the domain records.
 */
@Value
public class DomainEffect {
    String description;
    List<SecondaryFailure> secondaryFailures;

    public static DomainEffect applied(String description) {
        return new DomainEffect(description, List.of());
    }

    public static DomainEffect applied(String description, List<SecondaryFailure> secondaryFailures) {
        return new DomainEffect(description, List.copyOf(secondaryFailures));
    }

    /**
     * Nothing to mutate, e.g. a missing reference or an unknown order type.
     */
    public static DomainEffect skipped(String reason) {
        return new DomainEffect("skipped: " + reason, List.of());
    }
}
