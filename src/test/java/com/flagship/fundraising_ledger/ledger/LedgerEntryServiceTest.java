package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.allocation.AllocationEnforcement;
import com.flagship.fundraising_ledger.exception.AllocationOverrunException;
import com.flagship.fundraising_ledger.exception.LedgerValidationException;
import com.flagship.fundraising_ledger.exception.MutualExclusivityException;
import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.support.Drafts;
import com.flagship.fundraising_ledger.support.RollupFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class LedgerEntryServiceTest {

    private RollupFixture fixture;
    private LedgerEntryService service;
    private Club club;
    private Campaign campaign;
    private FundraisingEvent event;

    @BeforeEach
    void setUp() {
        fixture = new RollupFixture();
        service = fixture.ledgerEntryService;
        club = fixture.hierarchy.addClub("Harbour Rowing Club");
        campaign = fixture.hierarchy.addCampaign(club.getId(), "New Boat", "5000");
        event = fixture.hierarchy.addEvent(club.getId(), campaign.getId(), "Quiz Night", "1000");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private BigDecimal eventExpenses() {
        return fixture.hierarchy.findEvent(event.getId()).orElseThrow().getFinancials().getTotalExpenses();
    }

    private BigDecimal campaignExpenses() {
        return fixture.hierarchy.findCampaign(campaign.getId()).orElseThrow().getFinancials().getTotalExpenses();
    }

    private BigDecimal clubExpenses() {
        return fixture.hierarchy.findClub(club.getId()).orElseThrow().getFinancials().getTotalExpenses();
    }

    @Nested
    @DisplayName("Creating entries")
    class Create {

        @Test
        @DisplayName("An event expense rolls up to its campaign and club")
        void eventExpenseRollsUp() {
            LedgerMutationResult result = service.create(
                    Drafts.expense(club.getId(), null, event.getId(), "500"), null);

            assertEquals(OwnershipLevel.EVENT, result.getEntry().getLevel());
            assertEquals(SummaryStatus.FRESH, result.getSummaryStatus());
            assertEquals(new BigDecimal("500.00"), eventExpenses());
            assertEquals(new BigDecimal("500.00"), campaignExpenses());
            assertEquals(new BigDecimal("500.00"), clubExpenses());
            verify(fixture.outboxService).saveClubEvent(eq(club.getId()), eq("ExpenseRecorded"), any());
        }

        @Test
        @DisplayName("Invalid drafts are rejected before anything is written")
        void invalidDraftWritesNothing() {
            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                    () -> service.create(Drafts.income(club.getId(), null, null, "-10"), null));

            assertEquals(List.of("Amount must be greater than 0"), e.getViolations());
            assertEquals(0, fixture.records.size());
            assertEquals(0, fixture.hierarchy.getSaveCalls());
        }

        @Test
        @DisplayName("A campaign of another club is not found")
        void foreignCampaignIsNotFound() {
            Club other = fixture.hierarchy.addClub("Other Club");

            assertThrows(ResourceNotFoundException.class,
                    () -> service.create(Drafts.income(other.getId(), campaign.getId(), null, "10"), null));
            assertEquals(0, fixture.records.size());
        }

        @Test
        @DisplayName("Repeating an Idempotency-Key returns the first entry")
        void idempotentReplay() {
            LedgerMutationResult first = service.create(Drafts.income(club.getId(), null, null, "75"), "key-1");
            LedgerMutationResult second = service.create(Drafts.income(club.getId(), null, null, "75"), "key-1");

            assertFalse(first.isReplayed());
            assertTrue(second.isReplayed());
            assertEquals(first.getEntry().getId(), second.getEntry().getId());
            assertNull(second.getRecalculation());
            assertEquals(1, fixture.records.size());
            verify(fixture.outboxService, times(1)).saveClubEvent(eq(club.getId()), eq("IncomeRecorded"), any());
            assertEquals(1.0, fixture.counter("idempotency.cache", "result", "hit"));
        }

        @Test
        @DisplayName("Advisory mode records an overrunning allocation with a warning")
        void advisoryAllocationOverrun() {
            service.create(Drafts.income(club.getId(), null, null, "2000"), null);
            service.create(allocation(campaign.getId(), "1500"), null);

            LedgerMutationResult result = service.create(allocation(campaign.getId(), "600"), null);

            assertNotNull(result.getAllocationCheck());
            assertFalse(result.getAllocationCheck().isCanAllocate());
            assertEquals("Insufficient funds. Available: 500.00, Requested: 600.00", result.getAllocationWarning());
            assertEquals(3, fixture.records.size());
        }

        @Test
        @DisplayName("Strict mode rejects an overrunning allocation")
        void strictAllocationOverrun() {
            service.setEnforcement(AllocationEnforcement.STRICT);
            service.create(Drafts.income(club.getId(), null, null, "2000"), null);
            service.create(allocation(campaign.getId(), "1500"), null);

            AllocationOverrunException e = assertThrows(AllocationOverrunException.class,
                    () -> service.create(allocation(campaign.getId(), "600"), null));

            assertEquals(new BigDecimal("500.00"), e.getCheck().getAvailableForAllocation());
            assertEquals(2, fixture.records.size());
        }

        private LedgerEntryDraft allocation(UUID campaignId, String amount) {
            return fixture.allocationGuard.allocationDraft(club.getId(), OwnershipLevel.CAMPAIGN, campaignId,
                    new BigDecimal(amount), "Boat fund", LocalDate.of(2024, 3, 20));
        }
    }

    @Nested
    @DisplayName("Updating and deleting entries")
    class UpdateAndDelete {

        @Test
        @DisplayName("Moving a club entry to an event is a mutual exclusivity violation")
        void reassignmentIsRejected() {
            LedgerEntry income = service.create(Drafts.income(club.getId(), null, null, "100"), null).getEntry();
            LedgerEntryPatch patch = LedgerEntryPatch.builder().eventId(event.getId()).build();

            MutualExclusivityException e = assertThrows(MutualExclusivityException.class,
                    () -> service.update(EntryKind.INCOME, income.getId(), club.getId(), patch));

            assertTrue(e.getViolations().get(0).startsWith("Income cannot be moved"));
            assertNull(service.get(EntryKind.INCOME, income.getId(), club.getId()).getEventId());
        }

        @Test
        @DisplayName("An update changes amounts and recomputes the ancestors")
        void updateRecomputes() {
            LedgerEntry expense = service.create(
                    Drafts.expense(club.getId(), null, event.getId(), "500"), null).getEntry();

            LedgerMutationResult result = service.update(EntryKind.EXPENSE, expense.getId(), club.getId(),
                    LedgerEntryPatch.builder().amount("320.40").status("approved").build());

            Expense updated = (Expense) result.getEntry();
            assertEquals(new BigDecimal("320.40"), updated.getAmount());
            assertEquals(ExpenseStatus.APPROVED, updated.getStatus());
            assertEquals(new BigDecimal("320.40"), campaignExpenses());
            assertEquals(new BigDecimal("320.40"), clubExpenses());
        }

        @Test
        @DisplayName("A patch with no updatable field is rejected")
        void emptyPatchIsRejected() {
            LedgerEntry income = service.create(Drafts.income(club.getId(), null, null, "100"), null).getEntry();
            LedgerEntryPatch vendorOnly = LedgerEntryPatch.builder().vendor("Ignored for income").build();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.update(EntryKind.INCOME, income.getId(), club.getId(), vendorOnly));
            assertEquals("No valid fields to update", e.getMessage());
        }

        @Test
        @DisplayName("Deleting an event expense returns every total to zero")
        void deleteResetsTotals() {
            LedgerEntry expense = service.create(
                    Drafts.expense(club.getId(), null, event.getId(), "500"), null).getEntry();

            service.delete(EntryKind.EXPENSE, expense.getId(), club.getId());

            assertEquals(new BigDecimal("0.00"), eventExpenses());
            assertEquals(new BigDecimal("0.00"), campaignExpenses());
            assertEquals(new BigDecimal("0.00"), clubExpenses());
            verify(fixture.outboxService).saveClubEvent(eq(club.getId()), eq("ExpenseDeleted"), any());
        }

        @Test
        @DisplayName("Entries of another club cannot be read, changed or deleted")
        void otherClubCannotTouchEntry() {
            LedgerEntry income = service.create(Drafts.income(club.getId(), null, null, "100"), null).getEntry();
            UUID otherClub = fixture.hierarchy.addClub("Other Club").getId();

            ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                    () -> service.delete(EntryKind.INCOME, income.getId(), otherClub));
            assertEquals("Income record not found: " + income.getId(), e.getMessage());
            assertThrows(ResourceNotFoundException.class, () -> service.update(EntryKind.INCOME, income.getId(),
                    otherClub, LedgerEntryPatch.builder().amount("5").build()));
            verify(fixture.outboxService, never()).saveClubEvent(eq(otherClub), any(), any());
        }

        @Test
        @DisplayName("Node lists only hold entries attached to that node")
        void listForNode() {
            service.create(Drafts.income(club.getId(), null, null, "100"), null);
            service.create(Drafts.income(club.getId(), campaign.getId(), null, "200"), null);
            service.create(Drafts.income(club.getId(), null, event.getId(), "300"), null);

            assertEquals(1, service.listForNode(EntryKind.INCOME, club.getId(), null, null).size());
            assertEquals(new BigDecimal("200.00"), service.listForNode(
                    EntryKind.INCOME, club.getId(), campaign.getId(), null).get(0).getAmount());
            assertEquals(new BigDecimal("300.00"), service.listForNode(
                    EntryKind.INCOME, club.getId(), null, event.getId()).get(0).getAmount());
        }
    }
}
