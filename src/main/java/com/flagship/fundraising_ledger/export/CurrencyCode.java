package com.flagship.fundraising_ledger.export;

import java.util.Locale;

/**
 * ISO-4217 currencies a club can display its figures in. Amounts are stored
 * without a currency; this only affects formatting.
 */
public enum CurrencyCode {
    EUR, // Euro
    GBP, // British Pound
    USD, // US Dollar
    INR, // Indian Rupee
    JPY; // Japanese Yen

    public static final CurrencyCode DEFAULT = EUR;

    /**
     * @throws IllegalArgumentException for an unsupported code
     */
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid currency code: " + code);
        }
    }
}
