package com.flagship.fundraising_ledger.reporting;

import com.flagship.fundraising_ledger.export.CurrencyCode;
import com.flagship.fundraising_ledger.ledger.ClubAccess;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fundraising_ledger.reporting.dto.CampaignBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.ClubFinancialSummary;
import com.flagship.fundraising_ledger.reporting.dto.EventBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.LedgerView;
import com.flagship.fundraising_ledger.reporting.dto.MonthlyTrend;
import com.flagship.fundraising_ledger.reporting.dto.ReportRow;
import com.flagship.fundraising_ledger.rollup.EntryFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Financial summaries, breakdowns, reports and the club-wide ledger view.
 */
@RestController
@RequestMapping("/api")
public class FinancialsController {

    private final FinancialReportingService reportingService;
    private final Clock clock;
    private final String defaultCurrency;

    public FinancialsController(FinancialReportingService reportingService,
                                Clock clock,
                                @Value("${financials.default-currency:EUR}") String defaultCurrency) {
        this.reportingService = reportingService;
        this.clock = clock;
        this.defaultCurrency = defaultCurrency;
    }

    @GetMapping("/clubs/{clubId}/financials")
    public ClubFinancialSummary clubSummary(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "currency", required = false) String currency) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return reportingService.clubSummary(clubId, CurrencyCode.parse(currency != null ? currency : defaultCurrency));
    }

    @GetMapping("/events/{eventId}/financials")
    public EventBreakdown eventBreakdown(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return reportingService.eventBreakdown(clubId, eventId);
    }

    @GetMapping("/campaigns/{campaignId}/financials")
    public CampaignBreakdown campaignBreakdown(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return reportingService.campaignBreakdown(clubId, campaignId);
    }

    @GetMapping("/clubs/{clubId}/financials/reports/expenses-by-category")
    public List<ReportRow> expensesByCategory(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "campaign_id", required = false) UUID campaignId,
            @RequestParam(value = "event_id", required = false) UUID eventId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return reportingService.expensesByCategory(clubId,
                EntryFilter.fromParams(null, campaignId, eventId, null, null, null, startDate, endDate));
    }

    @GetMapping("/clubs/{clubId}/financials/reports/income-by-source")
    public List<ReportRow> incomeBySource(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "campaign_id", required = false) UUID campaignId,
            @RequestParam(value = "event_id", required = false) UUID eventId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return reportingService.incomeBySource(clubId,
                EntryFilter.fromParams(null, campaignId, eventId, null, null, null, startDate, endDate));
    }

    @GetMapping("/clubs/{clubId}/financials/trends")
    public List<MonthlyTrend> monthlyTrends(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam(value = "year", required = false) Integer year) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return reportingService.monthlyTrends(clubId, year != null ? year : LocalDate.now(clock).getYear());
    }

    @GetMapping("/clubs/{clubId}/financials/pending-expenses")
    public List<LedgerEntryResponse> pendingExpenses(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return reportingService.pendingExpenses(clubId);
    }

    @GetMapping("/clubs/{clubId}/ledger/income")
    public LedgerView incomeLedger(
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
        return reportingService.ledgerView(clubId, EntryKind.INCOME,
                EntryFilter.fromParams(level, campaignId, eventId, source, paymentMethod, null, startDate, endDate));
    }

    @GetMapping("/clubs/{clubId}/ledger/expenses")
    public LedgerView expenseLedger(
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
        return reportingService.ledgerView(clubId, EntryKind.EXPENSE,
                EntryFilter.fromParams(level, campaignId, eventId, category, paymentMethod, status, startDate, endDate));
    }
}
