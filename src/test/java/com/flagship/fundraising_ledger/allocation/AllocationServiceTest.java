package com.flagship.fundraising_ledger.allocation;

import com.flagship.fundraising_ledger.allocation.dto.AllocatedFundsSummary;
import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.CampaignFinancials;
import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.hierarchy.EntryScope;
import com.flagship.fundraising_ledger.hierarchy.EventFinancials;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.FundraisingHierarchyStore;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.LedgerEntryService;
import com.flagship.fundraising_ledger.ledger.LedgerMutationResult;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import com.flagship.fundraising_ledger.support.Drafts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AllocationServiceTest {

    @Mock
    private LedgerEntryService ledgerEntryService;
    @Mock
    private HierarchyResolver hierarchyResolver;
    @Mock
    private FundraisingHierarchyStore hierarchyStore;

    private AllocationService allocationService;

    private UUID clubId;
    private Campaign campaign;
    private FundraisingEvent event;

    @BeforeEach
    void setUp() {
        clubId = UUID.randomUUID();
        campaign = new Campaign(UUID.randomUUID(), clubId, "New Boat", new BigDecimal("5000"),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31), CampaignFinancials.empty(),
                SummaryStatus.FRESH, null);
        event = new FundraisingEvent(UUID.randomUUID(), clubId, null, "Quiz Night", new BigDecimal("800"),
                LocalDate.of(2024, 4, 12), EventFinancials.empty(), SummaryStatus.FRESH, null);

        AllocationGuard guard = new AllocationGuard(hierarchyResolver, new FinancialMetrics(new SimpleMeterRegistry()));
        Clock clock = Clock.fixed(Instant.parse("2024-05-02T10:15:30Z"), ZoneOffset.UTC);
        allocationService = new AllocationService(guard, ledgerEntryService, hierarchyResolver, hierarchyStore, clock);
    }

    @Test
    @DisplayName("Allocation to a campaign goes through the normal create path")
    void allocateToCampaign_CreatesAllocatedIncome() {
        LedgerEntry created = Drafts.allocationEntry(clubId, campaign.getId(), null, "250");
        when(hierarchyResolver.requireCampaign(clubId, campaign.getId())).thenReturn(campaign);
        when(ledgerEntryService.create(any(LedgerEntryDraft.class), eq("alloc-1")))
                .thenReturn(new LedgerMutationResult(created, null, null, false));

        LedgerMutationResult result = allocationService.allocateToCampaign(
                clubId, campaign.getId(), new BigDecimal("250"), null, "alloc-1");

        ArgumentCaptor<LedgerEntryDraft> captor = ArgumentCaptor.forClass(LedgerEntryDraft.class);
        verify(ledgerEntryService).create(captor.capture(), eq("alloc-1"));
        LedgerEntryDraft draft = captor.getValue();
        assertThat(draft.getKind()).isEqualTo(EntryKind.INCOME);
        assertThat(draft.getCampaignId()).isEqualTo(campaign.getId());
        assertThat(draft.getEventId()).isNull();
        assertThat(draft.getPaymentMethod()).isEqualTo("allocated_funds");
        assertThat(draft.getLabel()).isEqualTo(AllocationGuard.ALLOCATED_FUNDS_SOURCE);
        assertThat(draft.getDescription()).isEqualTo("Allocation to campaign New Boat");
        assertThat(draft.getDate()).isEqualTo("2024-05-02");
        assertThat(result.getEntry()).isSameAs(created);
    }

    @Test
    @DisplayName("A given description is kept for event allocations")
    void allocateToEvent_KeepsDescription() {
        when(hierarchyResolver.requireEvent(clubId, event.getId())).thenReturn(event);
        when(ledgerEntryService.create(any(LedgerEntryDraft.class), isNull()))
                .thenReturn(new LedgerMutationResult(Drafts.allocationEntry(clubId, null, event.getId(), "90"),
                        null, null, false));

        allocationService.allocateToEvent(clubId, event.getId(), new BigDecimal("90"), "Prize budget", null);

        ArgumentCaptor<LedgerEntryDraft> captor = ArgumentCaptor.forClass(LedgerEntryDraft.class);
        verify(ledgerEntryService).create(captor.capture(), isNull());
        assertThat(captor.getValue().getEventId()).isEqualTo(event.getId());
        assertThat(captor.getValue().getDescription()).isEqualTo("Prize budget");
    }

    @Test
    @DisplayName("Unknown targets are not found and nothing is created")
    void allocateToCampaign_UnknownCampaign() {
        UUID missing = UUID.randomUUID();
        when(hierarchyResolver.requireCampaign(clubId, missing))
                .thenThrow(new ResourceNotFoundException("Campaign not found: " + missing));

        assertThatThrownBy(() -> allocationService.allocateToCampaign(
                clubId, missing, BigDecimal.TEN, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(ledgerEntryService);
    }

    @Test
    @DisplayName("Summary groups allocations per node, largest first")
    void summarize_GroupsPerNode() {
        Campaign second = new Campaign(UUID.randomUUID(), clubId, "Kit Fund", new BigDecimal("1000"),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30), CampaignFinancials.empty(),
                SummaryStatus.FRESH, null);
        List<Campaign> campaigns = List.of(campaign, second);
        List<FundraisingEvent> events = List.of(event);
        List<LedgerEntry> income = List.of(
                Drafts.incomeEntry(clubId, null, null, "3000", LocalDate.of(2024, 1, 5)),
                Drafts.allocationEntry(clubId, campaign.getId(), null, "200"),
                Drafts.allocationEntry(clubId, campaign.getId(), null, "100"),
                Drafts.allocationEntry(clubId, second.getId(), null, "700"),
                Drafts.allocationEntry(clubId, null, event.getId(), "50"));

        when(hierarchyResolver.resolveScope(clubId, null, null)).thenReturn(EntryScope.club(clubId));
        when(hierarchyStore.listCampaigns(clubId)).thenReturn(campaigns);
        when(hierarchyStore.listEvents(clubId)).thenReturn(events);
        when(hierarchyResolver.collectClubWideEntries(clubId, EntryKind.INCOME, campaigns, events))
                .thenReturn(new ClubWideEntries(clubId, EntryKind.INCOME, income, List.of(), 0));

        AllocatedFundsSummary summary = allocationService.summarize(clubId);

        assertThat(summary.getTotalAllocated()).isEqualByComparingTo("1050");
        assertThat(summary.getAvailableForAllocation()).isEqualByComparingTo("1950");
        assertThat(summary.getCampaignAllocations())
                .extracting(AllocatedFundsSummary.NodeAllocation::getName)
                .containsExactly("Kit Fund", "New Boat");
        assertThat(summary.getCampaignAllocations().get(1).getAllocatedAmount()).isEqualByComparingTo("300");
        assertThat(summary.getCampaignAllocations().get(1).getAllocationCount()).isEqualTo(2);
        assertThat(summary.getEventAllocations()).hasSize(1);
        assertThat(summary.isPartial()).isFalse();
    }
}
