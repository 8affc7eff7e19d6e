package com.flagship.fundraising_ledger.export;

import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.Income;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes ledger entries as CSV. The header row is plain; every data field is
 * wrapped in double quotes with embedded quotes doubled. Rows end with \n.
 */
@Component
public class CsvExporter {

    static final List<String> INCOME_HEADERS =
            List.of("Date", "Source", "Description", "Amount", "Payment Method", "Reference");

    static final List<String> EXPENSE_HEADERS =
            List.of("Date", "Category", "Description", "Amount", "Vendor", "Payment Method", "Status");

    public String exportIncome(List<Income> income) {
        return write(INCOME_HEADERS, income, entry -> List.of(
                entry.getDate().toString(),
                nullToEmpty(entry.getSource()),
                nullToEmpty(entry.getDescription()),
                entry.getAmount().toPlainString(),
                entry.getPaymentMethod().getCode(),
                nullToEmpty(entry.getReference())));
    }

    public String exportExpenses(List<Expense> expenses) {
        return write(EXPENSE_HEADERS, expenses, entry -> List.of(
                entry.getDate().toString(),
                nullToEmpty(entry.getCategory()),
                nullToEmpty(entry.getDescription()),
                entry.getAmount().toPlainString(),
                nullToEmpty(entry.getVendor()),
                entry.getPaymentMethod().getCode(),
                entry.getStatus().getCode()));
    }

    private static <T> String write(List<String> headers, List<T> rows, Function<T, List<String>> fields) {
        Stream<String> header = Stream.of(String.join(",", headers));
        Stream<String> body = rows.stream()
                .map(fields)
                .map(values -> values.stream().map(CsvExporter::quote).collect(Collectors.joining(",")));
        return Stream.concat(header, body).collect(Collectors.joining("\n"));
    }

    static String quote(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
