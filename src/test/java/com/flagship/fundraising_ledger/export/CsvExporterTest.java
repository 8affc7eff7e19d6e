package com.flagship.fundraising_ledger.export;

import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.ExpensePaymentMethod;
import com.flagship.fundraising_ledger.ledger.ExpenseStatus;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.IncomePaymentMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CsvExporterTest {

    private final CsvExporter exporter = new CsvExporter();
    private final UUID clubId = UUID.randomUUID();

    @Test
    @DisplayName("Income export has a plain header and quoted fields")
    void exportsIncome() {
        Income income = Income.builder()
                .id(UUID.randomUUID())
                .ownerClubId(clubId)
                .source("Sponsor")
                .description("Shirt sponsor, \"gold\" tier")
                .amount(new BigDecimal("1500"))
                .date(LocalDate.of(2024, 3, 15))
                .paymentMethod(IncomePaymentMethod.SPONSORSHIP)
                .build();

        String csv = exporter.exportIncome(List.of(income));

        assertEquals("Date,Source,Description,Amount,Payment Method,Reference\n"
                + "\"2024-03-15\",\"Sponsor\",\"Shirt sponsor, \"\"gold\"\" tier\",\"1500.00\",\"sponsorship\",\"\"",
                csv);
    }

    @Test
    @DisplayName("Expense export includes vendor and status")
    void exportsExpenses() {
        Expense expense = Expense.builder()
                .id(UUID.randomUUID())
                .ownerClubId(clubId)
                .category("Venue")
                .description("Hall hire")
                .amount(new BigDecimal("200.5"))
                .date(LocalDate.of(2024, 2, 1))
                .vendor("Parish Hall")
                .paymentMethod(ExpensePaymentMethod.TRANSFER)
                .status(ExpenseStatus.PAID)
                .build();

        String[] lines = exporter.exportExpenses(List.of(expense)).split("\n");

        assertEquals(2, lines.length);
        assertEquals(String.join(",", CsvExporter.EXPENSE_HEADERS), lines[0]);
        assertEquals("\"2024-02-01\",\"Venue\",\"Hall hire\",\"200.50\",\"Parish Hall\",\"transfer\",\"paid\"", lines[1]);
    }

    @Test
    @DisplayName("An empty list exports only the header")
    void emptyExport() {
        assertEquals(String.join(",", CsvExporter.INCOME_HEADERS), exporter.exportIncome(List.of()));
    }

    @Test
    @DisplayName("Quotes are doubled")
    void quoting() {
        assertEquals("\"say \"\"hi\"\"\"", CsvExporter.quote("say \"hi\""));
    }
}
