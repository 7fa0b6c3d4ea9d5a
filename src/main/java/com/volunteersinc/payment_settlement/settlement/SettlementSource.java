package com.volunteersinc.payment_settlement.settlement;

/**
 * Which kind of ledger record a settlement started from.
 */
public enum SettlementSource {
    ONE_TIME,
    SUBSCRIPTION
}
