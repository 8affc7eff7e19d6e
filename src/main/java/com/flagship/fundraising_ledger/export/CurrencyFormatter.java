package com.flagship.fundraising_ledger.export;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Formats amounts for display using Irish English conventions, e.g.
 * "€1,234.50". NumberFormat is not thread safe, so one is built per call.
 */
@Component
public class CurrencyFormatter {

    private static final Locale LOCALE = Locale.forLanguageTag("en-IE");

    public String format(BigDecimal amount, CurrencyCode currency) {
        NumberFormat format = NumberFormat.getCurrencyInstance(LOCALE);
        format.setCurrency(Currency.getInstance(currency.name()));
        return format.format(amount != null ? amount : BigDecimal.ZERO);
    }
}
