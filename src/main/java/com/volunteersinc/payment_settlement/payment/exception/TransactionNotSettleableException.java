package com.volunteersinc.payment_settlement.payment.exception;

import com.volunteersinc.payment_settlement.settlement.exception.SettlementException;
import com.volunteersinc.payment_settlement.transaction.TransactionStatus;
import lombok.Getter;

/**
 * The transaction left pending without being completed, so a confirmation
 * for it can never settle.
 */
@Getter
public class TransactionNotSettleableException extends SettlementException {

    private final TransactionStatus status;

    public TransactionNotSettleableException(TransactionStatus status) {
        super("Transaction cannot be settled: status is " + status.getCode());
        this.status = status;
    }
}
