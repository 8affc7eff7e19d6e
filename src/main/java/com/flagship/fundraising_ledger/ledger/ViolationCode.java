package com.flagship.fundraising_ledger.ledger;

public enum ViolationCode {
    REQUIRED,
    NON_POSITIVE_AMOUNT,
    INVALID_DATE,
    MUTUAL_EXCLUSIVITY,
    INVALID_PAYMENT_METHOD,
    INVALID_STATUS
}
