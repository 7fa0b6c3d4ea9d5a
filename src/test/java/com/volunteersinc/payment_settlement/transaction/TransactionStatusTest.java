package com.volunteersinc.payment_settlement.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionStatusTest {

    @Test
    @DisplayName("Reads every status the ledger writes, case-insensitively")
    void readsStoredCodes() {
        assertEquals(TransactionStatus.PENDING, TransactionStatus.fromCode("pending"));
        assertEquals(TransactionStatus.COMPLETED, TransactionStatus.fromCode("Completed"));
        assertEquals(TransactionStatus.FAILED, TransactionStatus.fromCode("failed"));
        assertEquals(TransactionStatus.REFUNDED, TransactionStatus.fromCode("refunded"));
    }

    @Test
    @DisplayName("An unrecognized or missing status reads as unknown instead of failing the row")
    void toleratesUnknownCodes() {
        assertEquals(TransactionStatus.UNKNOWN, TransactionStatus.fromCode("chargeback"));
        assertEquals(TransactionStatus.UNKNOWN, TransactionStatus.fromCode(null));
    }

    @Test
    @DisplayName("Only pending transactions can be settled")
    void onlyPendingIsSettleable() {
        assertTrue(TransactionStatus.PENDING.isSettleable());
        assertFalse(TransactionStatus.COMPLETED.isSettleable());
        assertFalse(TransactionStatus.FAILED.isSettleable());
        assertFalse(TransactionStatus.REFUNDED.isSettleable());
        assertFalse(TransactionStatus.UNKNOWN.isSettleable());
    }

    @Test
    @DisplayName("Unrecognized subscription statuses are tolerated too")
    void subscriptionStatusTolerance() {
        assertEquals(SubscriptionStatus.ACTIVE, SubscriptionStatus.fromCode("active"));
        assertEquals(SubscriptionStatus.UNKNOWN, SubscriptionStatus.fromCode("paused"));
    }
}
