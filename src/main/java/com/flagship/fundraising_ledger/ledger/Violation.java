package com.flagship.fundraising_ledger.ledger;

import lombok.Value;

/**
 * One failed validation rule.
 */
@Value
public class Violation {
    String field;
    ViolationCode code;
    String message;
}
