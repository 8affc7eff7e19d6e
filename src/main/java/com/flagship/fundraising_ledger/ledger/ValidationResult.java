package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.exception.LedgerValidationException;
import com.flagship.fundraising_ledger.exception.MutualExclusivityException;
import lombok.Value;

import java.util.List;

/**
 * Outcome of validating a draft: either ok, or every violation found, in
 * rule order.
 */
@Value
public class ValidationResult {
    List<Violation> violations;

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult of(List<Violation> violations) {
        return new ValidationResult(List.copyOf(violations));
    }

    public boolean isOk() {
        return violations.isEmpty();
    }

    public List<String> getMessages() {
        return violations.stream().map(Violation::getMessage).toList();
    }

    public boolean hasMutualExclusivityViolation() {
        return violations.stream().anyMatch(v -> v.getCode() == ViolationCode.MUTUAL_EXCLUSIVITY);
    }

    /**
     * Throws the matching exception unless the result is ok.
     */
    public void throwIfInvalid() {
        if (isOk()) {
            return;
        }
        if (hasMutualExclusivityViolation()) {
            throw new MutualExclusivityException(getMessages());
        }
        throw new LedgerValidationException(getMessages());
    }
}
