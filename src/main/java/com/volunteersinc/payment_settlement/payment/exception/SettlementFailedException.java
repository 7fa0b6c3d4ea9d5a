package com.volunteersinc.payment_settlement.payment.exception;

import com.volunteersinc.payment_settlement.settlement.exception.SettlementException;

/**
 * Settlement of a confirmation failed. The cause tells whether a retry is
 * safe: a primary ledger failure can be resent, a domain mutation failure
 * is already queued for fulfillment retry.
 */
public class SettlementFailedException extends SettlementException {

    public SettlementFailedException(Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : "Settlement failed", cause);
    }
}
