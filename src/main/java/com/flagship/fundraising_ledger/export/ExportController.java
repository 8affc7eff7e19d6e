package com.flagship.fundraising_ledger.export;

import com.flagship.fundraising_ledger.ledger.ClubAccess;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.reporting.FinancialReportingService;
import com.flagship.fundraising_ledger.rollup.EntryFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * CSV downloads of the club-wide ledger. Accepts the ledger view filters.
 */
@RestController
@RequestMapping("/api/clubs/{clubId}")
@RequiredArgsConstructor
@Slf4j
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final FinancialReportingService reportingService;
    private final CsvExporter csvExporter;

    @GetMapping("/income/export")
    public ResponseEntity<String> exportIncome(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "level", required = false) String level,
            @RequestParam(value = "campaign_id", required = false) UUID campaignId,
            @RequestParam(value = "event_id", required = false) UUID eventId,
            @RequestParam(value = "source", required = false) String source,
            @RequestParam(value = "payment_method", required = false) String paymentMethod,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        EntryFilter filter = EntryFilter.fromParams(level, campaignId, eventId, source, paymentMethod, null,
                startDate, endDate);
        List<Income> income = reportingService.filteredEntries(clubId, EntryKind.INCOME, filter, Income.class);
        log.info("Exporting {} income rows for club {}", income.size(), clubId);
        return csv("income.csv", csvExporter.exportIncome(income));
    }

    @GetMapping("/expenses/export")
    public ResponseEntity<String> exportExpenses(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "level", required = false) String level,
            @RequestParam(value = "campaign_id", required = false) UUID campaignId,
            @RequestParam(value = "event_id", required = false) UUID eventId,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "payment_method", required = false) String paymentMethod,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        EntryFilter filter = EntryFilter.fromParams(level, campaignId, eventId, category, paymentMethod, status,
                startDate, endDate);
        List<Expense> expenses = reportingService.filteredEntries(clubId, EntryKind.EXPENSE, filter, Expense.class);
        log.info("Exporting {} expense rows for club {}", expenses.size(), clubId);
        return csv("expenses.csv", csvExporter.exportExpenses(expenses));
    }

    private static ResponseEntity<String> csv(String filename, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }
}
