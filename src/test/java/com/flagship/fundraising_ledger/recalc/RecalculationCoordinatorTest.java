package com.flagship.fundraising_ledger.recalc;

import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.ClubFinancials;
import com.flagship.fundraising_ledger.hierarchy.EntryScope;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.support.Drafts;
import com.flagship.fundraising_ledger.support.RollupFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RecalculationCoordinatorTest {

    private RollupFixture fixture;
    private RecalculationCoordinator coordinator;
    private Club club;
    private Campaign campaign;
    private FundraisingEvent event;
    private FundraisingEvent bakeSale;

    @BeforeEach
    void setUp() {
        fixture = new RollupFixture();
        coordinator = fixture.coordinator;
        club = fixture.hierarchy.addClub("Harbour Rowing Club");
        campaign = fixture.hierarchy.addCampaign(club.getId(), "New Boat", "1000");
        event = fixture.hierarchy.addEvent(club.getId(), campaign.getId(), "Quiz Night", "400");
        bakeSale = fixture.hierarchy.addEvent(club.getId(), null, "Bake Sale", "200");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void store(LedgerEntry entry) {
        fixture.records.createEntry(fixture.mapper.toStored(entry, null));
    }

    private EntryScope eventScope() {
        return EntryScope.event(club.getId(), event.getId(), campaign.getId());
    }

    @Test
    @DisplayName("An event change recomputes event, campaign and club in that order")
    void propagatesBottomUp() {
        store(Drafts.incomeEntry(club.getId(), null, event.getId(), "600", LocalDate.of(2024, 3, 1)));
        store(Drafts.expenseEntry(club.getId(), null, event.getId(), "150", LocalDate.of(2024, 3, 1)));
        store(Drafts.incomeEntry(club.getId(), campaign.getId(), null, "100", LocalDate.of(2024, 2, 1)));
        store(Drafts.incomeEntry(club.getId(), null, null, "50", LocalDate.of(2024, 1, 1)));

        RecalculationResult result = coordinator.recalculate(eventScope());

        assertEquals(List.of(OwnershipLevel.EVENT, OwnershipLevel.CAMPAIGN, OwnershipLevel.CLUB),
                result.getNodes().stream().map(NodeRecalculation::getLevel).toList());
        assertEquals(SummaryStatus.FRESH, result.getSummaryStatus());

        FundraisingEvent storedEvent = fixture.hierarchy.findEvent(event.getId()).orElseThrow();
        assertEquals(new BigDecimal("600.00"), storedEvent.getFinancials().getActualAmount());
        assertEquals(new BigDecimal("450.00"), storedEvent.getFinancials().getNetProfit());

        Campaign storedCampaign = fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow();
        assertEquals(new BigDecimal("700.00"), storedCampaign.getFinancials().getTotalRaised());
        assertEquals(new BigDecimal("150.00"), storedCampaign.getFinancials().getTotalExpenses());
        assertEquals(new BigDecimal("70.00"), storedCampaign.getFinancials().getProgressPercentage());

        ClubFinancials clubFinancials = fixture.hierarchy.findClub(club.getId()).orElseThrow().getFinancials();
        assertEquals(new BigDecimal("750.00"), clubFinancials.getTotalIncome());
        assertEquals(new BigDecimal("600.00"), clubFinancials.getNetProfit());
    }

    @Test
    @DisplayName("A club-level change recomputes only the club")
    void clubScopeRecomputesClubOnly() {
        RecalculationResult result = coordinator.recalculate(EntryScope.club(club.getId()));

        assertEquals(1, result.getNodes().size());
        assertEquals(OwnershipLevel.CLUB, result.getNodes().get(0).getLevel());
    }

    @Test
    @DisplayName("Club totals include allocations and report the allocation balance")
    void clubTotalsIncludeAllocations() {
        store(Drafts.incomeEntry(club.getId(), null, null, "2000", LocalDate.of(2024, 3, 1)));
        store(Drafts.allocationEntry(club.getId(), campaign.getId(), null, "1500"));

        coordinator.recalculateClub(club.getId());

        ClubFinancials financials = fixture.hierarchy.findClub(club.getId()).orElseThrow().getFinancials();
        assertEquals(new BigDecimal("3500.00"), financials.getTotalIncome());
        assertEquals(new BigDecimal("1500.00"), financials.getAllocatedFunds());
        assertEquals(new BigDecimal("500.00"), financials.getAvailableForAllocation());
    }

    @Test
    @DisplayName("Recomputing twice gives the same totals")
    void recomputeIsIdempotent() {
        store(Drafts.incomeEntry(club.getId(), null, event.getId(), "600", LocalDate.of(2024, 3, 1)));

        coordinator.recalculate(eventScope());
        Campaign first = fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow();
        coordinator.recalculate(eventScope());
        Campaign second = fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow();

        assertEquals(first.getFinancials(), second.getFinancials());
    }

    @Test
    @DisplayName("A transient failure is retried and the summary stays fresh")
    void transientFailureIsRetried() {
        store(Drafts.incomeEntry(club.getId(), campaign.getId(), null, "250", LocalDate.of(2024, 3, 1)));
        fixture.hierarchy.failSaves(OwnershipLevel.CAMPAIGN, 1);

        RecalculationResult result = coordinator.recalculateCampaign(club.getId(), campaign.getId());

        assertEquals(SummaryStatus.FRESH, result.getSummaryStatus());
        assertEquals(new BigDecimal("250.00"),
                fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow().getFinancials().getTotalRaised());
        assertEquals(1.0, fixture.counter("rollup.recompute.retries"));
    }

    @Test
    @DisplayName("Exhausted retries mark the node stale and ancestors still run")
    void exhaustedRetriesMarkStale() {
        store(Drafts.incomeEntry(club.getId(), null, event.getId(), "600", LocalDate.of(2024, 3, 1)));
        fixture.hierarchy.failSaves(OwnershipLevel.EVENT, RollupFixture.MAX_ATTEMPTS);

        RecalculationResult result = coordinator.recalculate(eventScope());

        assertEquals(SummaryStatus.STALE, result.getSummaryStatus());
        NodeRecalculation eventNode = result.getNodes().get(0);
        assertTrue(eventNode.isStale());
        assertNull(eventNode.getFinancials());
        assertEquals("could not write EVENT summary", eventNode.getFailureReason());
        assertEquals(SummaryStatus.STALE,
                fixture.hierarchy.findEvent(event.getId()).orElseThrow().getSummaryStatus());
        assertEquals(SummaryStatus.FRESH,
                fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow().getSummaryStatus());
        assertEquals(new BigDecimal("600.00"),
                fixture.hierarchy.findClub(club.getId()).orElseThrow().getFinancials().getTotalIncome());
        assertEquals(1.0, fixture.counter("rollup.summaries.stale", "level", "event"));
    }

    @Test
    @DisplayName("A partially collected club ledger is never stored as the club summary")
    void partialClubCollectionLeavesClubStale() {
        store(Drafts.incomeEntry(club.getId(), null, null, "100", LocalDate.of(2024, 3, 1)));
        coordinator.recalculateClub(club.getId());
        store(Drafts.incomeEntry(club.getId(), null, null, "900", LocalDate.of(2024, 3, 2)));
        fixture.records.failFetchesFor(bakeSale.getId());

        RecalculationResult result = coordinator.recalculateCampaign(club.getId(), campaign.getId());

        assertEquals(SummaryStatus.FRESH, result.getNodes().get(0).getSummaryStatus());
        assertEquals(SummaryStatus.STALE, result.getNodes().get(1).getSummaryStatus());
        Club stored = fixture.hierarchy.findClub(club.getId()).orElseThrow();
        assertEquals(SummaryStatus.STALE, stored.getSummaryStatus());
        assertEquals(new BigDecimal("100.00"), stored.getFinancials().getTotalIncome());
    }

    @Test
    @DisplayName("Concurrent recomputes of one club converge on the ledger totals")
    void concurrentRecomputesConverge() throws Exception {
        for (int i = 1; i <= 20; i++) {
            store(Drafts.incomeEntry(club.getId(), null, event.getId(), "10", LocalDate.of(2024, 3, i)));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<RecalculationResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> coordinator.recalculate(eventScope()));
            }
            for (Future<RecalculationResult> future : pool.invokeAll(tasks)) {
                assertEquals(SummaryStatus.FRESH, future.get().getSummaryStatus());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(new BigDecimal("200.00"),
                fixture.hierarchy.findClub(club.getId()).orElseThrow().getFinancials().getTotalIncome());
        assertEquals(0, fixture.locks.size());
    }
}
