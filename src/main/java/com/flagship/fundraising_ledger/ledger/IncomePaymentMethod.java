package com.flagship.fundraising_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Payment methods accepted for income.
 *
 * ALLOCATED_FUNDS marks money moved down from the club to a campaign or event
 * and is only written by the allocation path. Its wire code is
 * "allocated_funds"; the hyphenated "allocated-funds" is accepted on input.
 */
public enum IncomePaymentMethod {
    CASH("cash"),
    CARD("card"),
    TRANSFER("transfer"),
    CHEQUE("cheque"),
    INSTANT("instant"),
    SPONSORSHIP("sponsorship"),
    DONATION("donation"),
    TICKET_SALES("ticket_sales"),
    ALLOCATED_FUNDS("allocated_funds"),
    OTHER("other");

    public static final IncomePaymentMethod DEFAULT = CASH;

    private final String code;

    IncomePaymentMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<IncomePaymentMethod> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(method -> method.code.equals(normalized))
                .findFirst();
    }
}
