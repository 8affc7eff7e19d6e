package com.flagship.fundraising_ledger.allocation;

import com.flagship.fundraising_ledger.allocation.dto.AllocatedFundsSummary;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.FundraisingHierarchyStore;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.LedgerEntryService;
import com.flagship.fundraising_ledger.ledger.LedgerMutationResult;
import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Moves club funds down to campaigns and events, and reports where
 * allocated money went.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationService {

    private final AllocationGuard allocationGuard;
    private final LedgerEntryService ledgerEntryService;
    private final HierarchyResolver hierarchyResolver;
    private final FundraisingHierarchyStore hierarchyStore;
    private final Clock clock;

    public LedgerMutationResult allocateToCampaign(UUID clubId, UUID campaignId, BigDecimal amount,
                                                   String description, String idempotencyKey) {
        Campaign campaign = hierarchyResolver.requireCampaign(clubId, campaignId);
        String text = description != null && !description.isBlank()
                ? description : "Allocation to campaign " + campaign.getName();
        return allocate(clubId, OwnershipLevel.CAMPAIGN, campaignId, amount, text, idempotencyKey);
    }

    public LedgerMutationResult allocateToEvent(UUID clubId, UUID eventId, BigDecimal amount,
                                                String description, String idempotencyKey) {
        FundraisingEvent event = hierarchyResolver.requireEvent(clubId, eventId);
        String text = description != null && !description.isBlank()
                ? description : "Allocation to event " + event.getTitle();
        return allocate(clubId, OwnershipLevel.EVENT, eventId, amount, text, idempotencyKey);
    }

    private LedgerMutationResult allocate(UUID clubId, OwnershipLevel level, UUID targetId, BigDecimal amount,
                                          String description, String idempotencyKey) {
        LedgerEntryDraft draft = allocationGuard.allocationDraft(
                clubId, level, targetId, amount, description, LocalDate.now(clock));
        log.info("Allocating {} from club {} to {} {}", amount, clubId, level, targetId);
        return ledgerEntryService.create(draft, idempotencyKey);
    }

    public AllocatedFundsSummary summarize(UUID clubId) {
        hierarchyResolver.resolveScope(clubId, null, null);
        List<Campaign> campaigns = hierarchyStore.listCampaigns(clubId);
        List<FundraisingEvent> events = hierarchyStore.listEvents(clubId);
        ClubWideEntries income = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.INCOME, campaigns, events);
        List<Income> incomes = income.entriesOf(Income.class);
        AllocationPosition position = allocationGuard.position(clubId, incomes, income.isPartial());

        List<Income> allocations = incomes.stream().filter(Income::isAllocation).toList();
        Map<UUID, List<Income>> byCampaign = allocations.stream()
                .filter(i -> i.getLevel() == OwnershipLevel.CAMPAIGN)
                .collect(Collectors.groupingBy(Income::getCampaignId));
        Map<UUID, List<Income>> byEvent = allocations.stream()
                .filter(i -> i.getLevel() == OwnershipLevel.EVENT)
                .collect(Collectors.groupingBy(Income::getEventId));

        return AllocatedFundsSummary.builder()
                .clubId(clubId)
                .totalAllocated(position.getTotalAllocated())
                .availableForAllocation(position.getAvailableForAllocation())
                .campaignAllocations(nodeAllocations(campaigns, Campaign::getId, Campaign::getName, byCampaign))
                .eventAllocations(nodeAllocations(events, FundraisingEvent::getId, FundraisingEvent::getTitle, byEvent))
                .partial(position.isPartial())
                .build();
    }

    private static <N> List<AllocatedFundsSummary.NodeAllocation> nodeAllocations(
            List<N> nodes, Function<N, UUID> idFn, Function<N, String> nameFn, Map<UUID, List<Income>> grouped) {
        return nodes.stream()
                .filter(node -> grouped.containsKey(idFn.apply(node)))
                .map(node -> {
                    List<Income> entries = grouped.get(idFn.apply(node));
                    return new AllocatedFundsSummary.NodeAllocation(idFn.apply(node), nameFn.apply(node),
                            MoneyUtil.sum(entries.stream().map(Income::getAmount).toList()), entries.size());
                })
                .sorted((a, b) -> b.getAllocatedAmount().compareTo(a.getAllocatedAmount()))
                .toList();
    }
}
