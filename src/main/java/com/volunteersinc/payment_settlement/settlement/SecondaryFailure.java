package com.volunteersinc.payment_settlement.settlement;

import lombok.Value;

/**
 * A tolerated failure of a secondary effect.
 *
 * These are collected and returned, never thrown: the primary effects they
 * follow have already committed and stay committed.
 */
@Value
public class SecondaryFailure {
    SecondaryEffect effect;
    String message;

    public static SecondaryFailure of(SecondaryEffect effect, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SecondaryFailure(effect, message);
    }
}
