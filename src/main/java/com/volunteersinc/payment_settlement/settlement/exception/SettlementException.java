package com.volunteersinc.payment_settlement.settlement.exception;

/**
 * Base type of every failure the confirmation pipeline reports to callers.
 */
public abstract class SettlementException extends RuntimeException {

    protected SettlementException(String message) {
        super(message);
    }

    protected SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
