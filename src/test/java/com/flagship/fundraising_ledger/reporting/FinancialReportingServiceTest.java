package com.flagship.fundraising_ledger.reporting;

import com.flagship.fundraising_ledger.export.CurrencyCode;
import com.flagship.fundraising_ledger.export.CurrencyFormatter;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.reporting.dto.CampaignBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.ClubFinancialSummary;
import com.flagship.fundraising_ledger.reporting.dto.EventBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.LedgerView;
import com.flagship.fundraising_ledger.reporting.dto.MonthlyTrend;
import com.flagship.fundraising_ledger.reporting.dto.ReportRow;
import com.flagship.fundraising_ledger.rollup.EntryFilter;
import com.flagship.fundraising_ledger.rollup.FinancialStatus;
import com.flagship.fundraising_ledger.support.Drafts;
import com.flagship.fundraising_ledger.support.RollupFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FinancialReportingServiceTest {

    private RollupFixture fixture;
    private FinancialReportingService reporting;
    private Club club;
    private Campaign campaign;
    private FundraisingEvent event;

    @BeforeEach
    void setUp() {
        fixture = new RollupFixture();
        reporting = new FinancialReportingService(fixture.resolver, fixture.hierarchy, fixture.calculator,
                fixture.allocationGuard, new CurrencyFormatter());
        club = fixture.hierarchy.addClub("Harbour Rowing Club");
        campaign = fixture.hierarchy.addCampaign(club.getId(), "New Boat", "1000");
        event = fixture.hierarchy.addEvent(club.getId(), campaign.getId(), "Quiz Night", "400");

        record(income(null, null, "2000", "Membership", "2024-01-20"));
        record(income(campaign.getId(), null, "300", "Donation", "2024-03-02"));
        record(income(null, event.getId(), "450", "Tickets", "2024-03-15"));
        record(expense(null, event.getId(), "120", "Venue", "approved", "2024-03-15"));
        record(expense(null, event.getId(), "30", "Printing", null, "2024-03-16"));
        record(expense(null, null, "80", "Venue", "paid", "2024-04-01"));
        record(fixture.allocationGuard.allocationDraft(club.getId(), OwnershipLevel.CAMPAIGN, campaign.getId(),
                new BigDecimal("500"), "Boat fund", LocalDate.of(2024, 2, 1)));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void record(LedgerEntryDraft draft) {
        fixture.ledgerEntryService.create(draft, null);
    }

    private LedgerEntryDraft income(UUID campaignId, UUID eventId, String amount, String source, String date) {
        return Drafts.income(club.getId(), campaignId, eventId, amount).toBuilder()
                .label(source)
                .date(date)
                .build();
    }

    private LedgerEntryDraft expense(UUID campaignId, UUID eventId, String amount, String category,
                                     String status, String date) {
        return Drafts.expense(club.getId(), campaignId, eventId, amount).toBuilder()
                .label(category)
                .status(status)
                .date(date)
                .build();
    }

    @Test
    @DisplayName("Club summary totals every level and reports the allocation balance")
    void clubSummary() {
        ClubFinancialSummary summary = reporting.clubSummary(club.getId(), CurrencyCode.EUR);

        assertEquals(new BigDecimal("3250.00"), summary.getTotalIncome());
        assertEquals(new BigDecimal("230.00"), summary.getTotalExpenses());
        assertEquals(new BigDecimal("3020.00"), summary.getNetProfit());
        assertEquals(new BigDecimal("30.00"), summary.getPendingExpenses());
        assertEquals(new BigDecimal("200.00"), summary.getApprovedExpenses());
        assertEquals(new BigDecimal("500.00"), summary.getAllocatedFunds());
        assertEquals(new BigDecimal("2250.00"), summary.getAvailableForAllocation());
        assertEquals(new BigDecimal("2000.00"), summary.getClubLevelIncome());
        assertEquals(new BigDecimal("80.00"), summary.getClubLevelExpenses());
        assertEquals("€3,250.00", summary.getFormatted().get("total_income"));
        assertEquals(List.of("Venue", "Printing"), List.copyOf(summary.getExpensesByCategory().keySet()));
        assertFalse(summary.isPartial());

        assertEquals(1, summary.getCampaignPerformance().size());
        assertEquals(new BigDecimal("1250.00"), summary.getCampaignPerformance().get(0).getActualAmount());
        assertEquals(new BigDecimal("100.00"), summary.getCampaignPerformance().get(0).getProgressPercentage());
        assertEquals(new BigDecimal("125.00"), summary.getCampaignPerformance().get(0).getAchievementPercentage());
        assertEquals(FinancialStatus.EXCELLENT, summary.getCampaignPerformance().get(0).getFinancialStatus());
        assertEquals(new BigDecimal("500.00"), summary.getCampaignPerformance().get(0).getAllocatedFunds());
    }

    @Test
    @DisplayName("A failed sub-fetch marks the summary partial instead of failing")
    void partialSummary() {
        fixture.records.failFetchesFor(event.getId());

        ClubFinancialSummary summary = assertDoesNotThrow(() -> reporting.clubSummary(club.getId(), CurrencyCode.GBP));

        assertTrue(summary.isPartial());
        assertEquals(new BigDecimal("2800.00"), summary.getTotalIncome());
    }

    @Test
    @DisplayName("End date filter keeps entries dated on the end day")
    void ledgerViewDateFilter() {
        EntryFilter filter = EntryFilter.fromParams(null, null, null, null, null, null, null, "2024-03-15");

        LedgerView view = reporting.ledgerView(club.getId(), EntryKind.EXPENSE, filter);

        assertEquals(1, view.getCount());
        assertEquals(new BigDecimal("120.00"), view.getTotal());
        assertEquals(new BigDecimal("120.00"), view.getApprovedTotal());
        assertEquals(new BigDecimal("0.00"), view.getPendingTotal());
        assertNull(view.getFailedScopes());
    }

    @Test
    @DisplayName("Ledger view can be narrowed to one level")
    void ledgerViewLevelFilter() {
        LedgerView view = reporting.ledgerView(club.getId(), EntryKind.INCOME,
                EntryFilter.builder().level(OwnershipLevel.CAMPAIGN).build());

        assertEquals(2, view.getCount());
        assertEquals(new BigDecimal("800.00"), view.getTotal());
        assertNull(view.getApprovedTotal());
    }

    @Test
    @DisplayName("Event breakdown groups entries and rates the event against its goal")
    void eventBreakdown() {
        EventBreakdown breakdown = reporting.eventBreakdown(club.getId(), event.getId());

        assertEquals(new BigDecimal("450.00"), breakdown.getSummary().getActualAmount());
        assertEquals(new BigDecimal("300.00"), breakdown.getSummary().getNetProfit());
        assertEquals(FinancialStatus.EXCELLENT, breakdown.getSummary().getFinancialStatus());
        assertEquals(1, breakdown.getIncomeBreakdown().size());
        assertEquals("Tickets", breakdown.getIncomeBreakdown().get(0).getSource());
        assertEquals(2, breakdown.getExpenseBreakdown().size());
        assertEquals("Venue", breakdown.getExpenseBreakdown().get(0).getCategory());
        assertEquals("approved", breakdown.getExpenseBreakdown().get(0).getStatus());
    }

    @Test
    @DisplayName("Campaign breakdown combines own and event entries")
    void campaignBreakdown() {
        CampaignBreakdown breakdown = reporting.campaignBreakdown(club.getId(), campaign.getId());

        assertEquals(new BigDecimal("1250.00"), breakdown.getSummary().getActualAmount());
        assertEquals(new BigDecimal("150.00"), breakdown.getSummary().getTotalExpenses());
        assertEquals(new BigDecimal("450.00"), breakdown.getEventIncomeTotal());
        assertEquals(new BigDecimal("150.00"), breakdown.getEventExpensesTotal());
        assertEquals(2, breakdown.getCampaignIncome().size());
        assertEquals(1, breakdown.getEvents().size());
    }

    @Test
    @DisplayName("Expense report groups by category with min, max and average")
    void expensesByCategory() {
        List<ReportRow> rows = reporting.expensesByCategory(club.getId(), EntryFilter.none());

        assertEquals(2, rows.size());
        ReportRow venue = rows.get(0);
        assertEquals("Venue", venue.getCategory());
        assertEquals(2, venue.getTransactionCount());
        assertEquals(new BigDecimal("200.00"), venue.getTotalAmount());
        assertEquals(new BigDecimal("100.00"), venue.getAverageAmount());
        assertEquals(new BigDecimal("80.00"), venue.getMinAmount());
        assertEquals(new BigDecimal("120.00"), venue.getMaxAmount());
    }

    @Test
    @DisplayName("Monthly trends cover all twelve months")
    void monthlyTrends() {
        List<MonthlyTrend> trends = reporting.monthlyTrends(club.getId(), 2024);

        assertEquals(12, trends.size());
        MonthlyTrend march = trends.get(2);
        assertEquals(3, march.getMonth());
        assertEquals(new BigDecimal("750.00"), march.getTotalIncome());
        assertEquals(new BigDecimal("150.00"), march.getTotalExpenses());
        assertEquals(new BigDecimal("600.00"), march.getNetProfit());
        assertEquals(new BigDecimal("0.00"), trends.get(11).getTotalIncome());
        assertEquals(new BigDecimal("0.00"), reporting.monthlyTrends(club.getId(), 2023).get(2).getTotalIncome());
    }

    @Test
    @DisplayName("Pending expenses lists only unapproved expenses")
    void pendingExpenses() {
        assertEquals(1, reporting.pendingExpenses(club.getId()).size());
    }
}
