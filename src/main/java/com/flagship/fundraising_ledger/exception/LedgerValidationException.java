package com.flagship.fundraising_ledger.exception;

import java.util.List;

/**
 * A draft entry failed one or more validation rules. Carries every
 * violation message, in rule order.
 */
public class LedgerValidationException extends RuntimeException {

    private final List<String> violations;

    public LedgerValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
