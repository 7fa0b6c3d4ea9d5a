package com.volunteersinc.payment_settlement.payment.exception;

import com.volunteersinc.payment_settlement.settlement.exception.SettlementException;

public class RecordNotFoundException extends SettlementException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
