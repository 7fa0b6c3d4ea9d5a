package com.volunteersinc.payment_settlement.fulfillment;

/**
 * User account kind, deciding which membership flags a payment grants.
 */
public enum AccountType {
    INDIVIDUAL,
    ORGANIZATION;

    /**
     * Anything other than "organization", including a missing value, is
     * treated as an individual account.
     */
    public static AccountType fromCode(String code) {
        return "organization".equalsIgnoreCase(code) ? ORGANIZATION : INDIVIDUAL;
    }
}
