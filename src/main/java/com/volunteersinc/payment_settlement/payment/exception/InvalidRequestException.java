package com.volunteersinc.payment_settlement.payment.exception;

import com.volunteersinc.payment_settlement.settlement.exception.SettlementException;

/**
 * The request is malformed. Retrying it unchanged will fail again.
 */
public class InvalidRequestException extends SettlementException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
