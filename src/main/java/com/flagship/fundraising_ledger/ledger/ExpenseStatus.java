package com.flagship.fundraising_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Approval state of an expense. New expenses start as PENDING.
 */
public enum ExpenseStatus {
    PENDING("pending"),
    APPROVED("approved"),
    PAID("paid");

    public static final ExpenseStatus DEFAULT = PENDING;

    private final String code;

    ExpenseStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Approved and paid expenses both count as approved in summaries.
     */
    public boolean isApproved() {
        return this != PENDING;
    }

    public static Optional<ExpenseStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.code.equals(normalized))
                .findFirst();
    }
}
