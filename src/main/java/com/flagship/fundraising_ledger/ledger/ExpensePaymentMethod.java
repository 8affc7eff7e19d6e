package com.flagship.fundraising_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Payment methods accepted for expenses.
 */
public enum ExpensePaymentMethod {
    CASH("cash"),
    CARD("card"),
    TRANSFER("transfer"),
    CHEQUE("cheque"),
    INSTANT("instant"),
    OTHER("other");

    public static final ExpensePaymentMethod DEFAULT = CARD;

    private final String code;

    ExpensePaymentMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<ExpensePaymentMethod> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.code.equals(normalized))
                .findFirst();
    }
}
