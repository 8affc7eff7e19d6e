package com.flagship.fundraising_ledger.allocation;

import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.support.Drafts;
import com.flagship.fundraising_ledger.support.RollupFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllocationGuardTest {

    private RollupFixture fixture;
    private AllocationGuard guard;
    private Club club;
    private Campaign campaign;
    private FundraisingEvent event;

    @BeforeEach
    void setUp() {
        fixture = new RollupFixture();
        guard = fixture.allocationGuard;
        club = fixture.hierarchy.addClub("Harbour Rowing Club");
        campaign = fixture.hierarchy.addCampaign(club.getId(), "New Boat", "5000");
        event = fixture.hierarchy.addEvent(club.getId(), null, "Bake Sale", "200");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void store(LedgerEntry entry) {
        fixture.records.createEntry(fixture.mapper.toStored(entry, null));
    }

    @Test
    @DisplayName("Allocating more than the club holds is reported with a warning")
    void overrunIsReported() {
        store(Drafts.incomeEntry(club.getId(), null, null, "2000", LocalDate.of(2024, 3, 1)));
        store(Drafts.allocationEntry(club.getId(), campaign.getId(), null, "1500"));

        AllocationCheck check = guard.checkAllocation(club.getId(), new BigDecimal("600"));

        assertFalse(check.isCanAllocate());
        assertEquals(new BigDecimal("500.00"), check.getAvailableForAllocation());
        assertEquals(new BigDecimal("2000.00"), check.getTotalIncome());
        assertEquals(new BigDecimal("1500.00"), check.getTotalAllocated());
        assertEquals(new BigDecimal("600.00"), check.getRequestedAmount());
        assertEquals("Insufficient funds. Available: 500.00, Requested: 600.00", check.getWarning());
        assertEquals(1.0, fixture.counter("allocation.checks", "result", "overrun"));
    }

    @Test
    @DisplayName("Allocating exactly what is available is allowed")
    void exactAmountIsAllowed() {
        store(Drafts.incomeEntry(club.getId(), null, null, "2000", LocalDate.of(2024, 3, 1)));
        store(Drafts.allocationEntry(club.getId(), null, event.getId(), "1500"));

        AllocationCheck check = guard.checkAllocation(club.getId(), new BigDecimal("500"));

        assertTrue(check.isCanAllocate());
        assertNull(check.getWarning());
    }

    @Test
    @DisplayName("Income raised by campaigns and events counts as held income")
    void nodeIncomeIsHeld() {
        List<Income> income = List.of(
                Drafts.incomeEntry(club.getId(), null, null, "1000", LocalDate.of(2024, 3, 1)),
                Drafts.incomeEntry(club.getId(), null, event.getId(), "300", LocalDate.of(2024, 3, 2)),
                Drafts.allocationEntry(club.getId(), campaign.getId(), null, "400"));

        AllocationPosition position = guard.position(club.getId(), income, false);

        assertEquals(new BigDecimal("1700.00"), position.getTotalIncome());
        assertEquals(new BigDecimal("1300.00"), position.getHeldIncome());
        assertEquals(new BigDecimal("400.00"), position.getTotalAllocated());
        assertEquals(new BigDecimal("900.00"), position.getAvailableForAllocation());
    }

    @Test
    @DisplayName("Available funds never go below zero")
    void availableIsFloored() {
        List<Income> income = List.of(
                Drafts.incomeEntry(club.getId(), null, null, "100", LocalDate.of(2024, 3, 1)),
                Drafts.allocationEntry(club.getId(), campaign.getId(), null, "400"));

        AllocationPosition position = guard.position(club.getId(), income, false);

        assertEquals(new BigDecimal("0.00"), position.getAvailableForAllocation());
    }

    @Test
    @DisplayName("A partially read ledger adds a warning even when the amount fits")
    void partialReadWarns() {
        store(Drafts.incomeEntry(club.getId(), null, null, "2000", LocalDate.of(2024, 3, 1)));
        fixture.records.failFetchesFor(event.getId());

        AllocationCheck check = guard.checkAllocation(club.getId(), new BigDecimal("100"));

        assertTrue(check.isCanAllocate());
        assertNotNull(check.getWarning());
        assertTrue(check.getWarning().contains("partially"));
    }

    @Test
    @DisplayName("Non-positive requests are rejected")
    void rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class,
                () -> guard.checkAllocation(club.getId(), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Allocation drafts target a campaign or event with the allocated funds method")
    void allocationDraft() {
        LedgerEntryDraft draft = guard.allocationDraft(club.getId(), OwnershipLevel.EVENT, event.getId(),
                new BigDecimal("250"), "Seed money", LocalDate.of(2024, 5, 1));

        assertEquals(event.getId(), draft.getEventId());
        assertNull(draft.getCampaignId());
        assertEquals("allocated_funds", draft.getPaymentMethod());
        assertEquals("2024-05-01", draft.getDate());
        assertThrows(IllegalArgumentException.class, () -> guard.allocationDraft(club.getId(),
                OwnershipLevel.CLUB, club.getId(), BigDecimal.TEN, "x", LocalDate.of(2024, 5, 1)));
    }
}
