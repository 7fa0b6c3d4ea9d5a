package com.volunteersinc.payment_settlement.settlement.exception;

import java.util.UUID;

/**
 * A domain record update failed after the ledger update committed.
 *
 * The ledger now says completed, so resending the confirmation would
 * short-circuit. Recovery goes through the fulfillment retry event instead.
 */
public class DomainMutationFailureException extends SettlementException {

    private final UUID recordId;
    private final String kind;

    public DomainMutationFailureException(UUID recordId, String kind, Throwable cause) {
        super(String.format("Fulfillment of %s %s failed: %s", kind, recordId, cause.getMessage()), cause);
        this.recordId = recordId;
        this.kind = kind;
    }

    public UUID getRecordId() {
        return recordId;
    }

    public String getKind() {
        return kind;
    }
}
