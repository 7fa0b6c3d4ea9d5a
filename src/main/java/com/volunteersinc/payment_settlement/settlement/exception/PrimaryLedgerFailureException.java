package com.volunteersinc.payment_settlement.settlement.exception;

import java.util.UUID;

/**
 * The ledger status update failed. Nothing downstream ran, so the
 * confirmation can be retried as is.
 */
public class PrimaryLedgerFailureException extends SettlementException {

    private final UUID recordId;

    public PrimaryLedgerFailureException(UUID recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public PrimaryLedgerFailureException(UUID recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public UUID getRecordId() {
        return recordId;
    }
}
