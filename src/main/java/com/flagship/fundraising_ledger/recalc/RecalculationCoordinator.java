package com.flagship.fundraising_ledger.recalc;

import com.flagship.fundraising_ledger.allocation.AllocationGuard;
import com.flagship.fundraising_ledger.allocation.AllocationPosition;
import com.flagship.fundraising_ledger.exception.RecomputeFailureException;
import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.CampaignFinancials;
import com.flagship.fundraising_ledger.hierarchy.ClubFinancials;
import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.hierarchy.EntryScope;
import com.flagship.fundraising_ledger.hierarchy.EventFinancials;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.FundraisingHierarchyStore;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import com.flagship.fundraising_ledger.rollup.RollupCalculator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Brings stored summaries back in line with the ledger after a change.
 *
 * Order: the node the entry belongs to, then the campaign above an event
 * (when there is one), then always the club. Every node is recomputed from
 * a fresh read of its entries, so running it twice gives the same totals.
 *
 * Each node recompute is retried with exponential backoff. When the retries
 * run out the node is marked STALE and the coordinator carries on with the
 * ancestors; the change that triggered it is never rolled back.
 */
@Service
@Slf4j
public class RecalculationCoordinator {

    public static final String RETRY_NAME = "recalculation";

    private final HierarchyResolver hierarchyResolver;
    private final FundraisingHierarchyStore hierarchyStore;
    private final RollupCalculator calculator;
    private final AllocationGuard allocationGuard;
    private final RecomputeLocks locks;
    private final FinancialMetrics metrics;
    private final Retry retry;

    public RecalculationCoordinator(HierarchyResolver hierarchyResolver,
                                    FundraisingHierarchyStore hierarchyStore,
                                    RollupCalculator calculator,
                                    AllocationGuard allocationGuard,
                                    RecomputeLocks locks,
                                    FinancialMetrics metrics,
                                    RetryRegistry retryRegistry) {
        this.hierarchyResolver = hierarchyResolver;
        this.hierarchyStore = hierarchyStore;
        this.calculator = calculator;
        this.allocationGuard = allocationGuard;
        this.locks = locks;
        this.metrics = metrics;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.retry.getEventPublisher().onRetry(event -> {
            metrics.recordRecomputeRetry();
            log.debug("Retrying recompute (attempt {}): {}",
                    event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage());
        });
    }

    public RecalculationResult onEntryChanged(LedgerEntry entry) {
        return recalculate(hierarchyResolver.scopeOf(entry));
    }

    public RecalculationResult recalculate(EntryScope scope) {
        UUID clubId = scope.getClubId();
        List<NodeRecalculation> nodes = new ArrayList<>();
        switch (scope.getLevel()) {
            case EVENT -> {
                nodes.add(recomputeEvent(clubId, scope.getNodeId()));
                if (scope.getParentCampaignId() != null) {
                    nodes.add(recomputeCampaign(clubId, scope.getParentCampaignId()));
                }
            }
            case CAMPAIGN -> nodes.add(recomputeCampaign(clubId, scope.getNodeId()));
            case CLUB -> {
                // club is recomputed below in every case
            }
        }
        nodes.add(recomputeClub(clubId));

        RecalculationResult result = new RecalculationResult(List.copyOf(nodes));
        log.info("Recalculated {} {} and ancestors: {}", scope.getLevel(), scope.getNodeId(), result.getSummaryStatus());
        return result;
    }

    public RecalculationResult recalculateEvent(UUID clubId, UUID eventId) {
        return recalculate(hierarchyResolver.resolveScope(clubId, null, eventId));
    }

    public RecalculationResult recalculateCampaign(UUID clubId, UUID campaignId) {
        return recalculate(hierarchyResolver.resolveScope(clubId, campaignId, null));
    }

    public RecalculationResult recalculateClub(UUID clubId) {
        return recalculate(hierarchyResolver.resolveScope(clubId, null, null));
    }

    private NodeRecalculation recomputeEvent(UUID clubId, UUID eventId) {
        RecomputeKey key = new RecomputeKey(clubId, OwnershipLevel.EVENT, eventId);
        return run(key, () -> {
            List<LedgerEntry> income = hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.EVENT, eventId);
            List<LedgerEntry> expenses = hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.EVENT, eventId);
            EventFinancials financials = calculator.eventFinancials(income, expenses);
            hierarchyStore.saveEventFinancials(eventId, financials);
            return financials;
        });
    }

    private NodeRecalculation recomputeCampaign(UUID clubId, UUID campaignId) {
        RecomputeKey key = new RecomputeKey(clubId, OwnershipLevel.CAMPAIGN, campaignId);
        return run(key, () -> {
            Campaign campaign = hierarchyStore.findCampaign(campaignId)
                    .orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + campaignId));
            List<LedgerEntry> income = new ArrayList<>(
                    hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.CAMPAIGN, campaignId));
            List<LedgerEntry> expenses = new ArrayList<>(
                    hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.CAMPAIGN, campaignId));
            for (FundraisingEvent event : hierarchyStore.listEventsForCampaign(campaignId)) {
                income.addAll(hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.EVENT, event.getId()));
                expenses.addAll(hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.EVENT, event.getId()));
            }
            CampaignFinancials financials =
                    calculator.campaignFinancials(income, expenses, campaign.getTargetAmount());
            hierarchyStore.saveCampaignFinancials(campaignId, financials);
            return financials;
        });
    }

    private NodeRecalculation recomputeClub(UUID clubId) {
        RecomputeKey key = new RecomputeKey(clubId, OwnershipLevel.CLUB, clubId);
        return run(key, () -> {
            List<Campaign> campaigns = hierarchyStore.listCampaigns(clubId);
            List<FundraisingEvent> events = hierarchyStore.listEvents(clubId);
            ClubWideEntries income = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.INCOME, campaigns, events);
            ClubWideEntries expenses = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.EXPENSE, campaigns, events);
            if (income.isPartial() || expenses.isPartial()) {
                throw new RecomputeFailureException("Club " + clubId + " ledger was only partially collected ("
                        + (income.getFailedScopes().size() + expenses.getFailedScopes().size()) + " failed fetches, "
                        + (income.getMalformedRecords() + expenses.getMalformedRecords()) + " malformed rows)");
            }
            BigDecimal totalIncome = calculator.totalOf(income.getEntries());
            BigDecimal totalExpenses = calculator.totalOf(expenses.getEntries());
            AllocationPosition position = allocationGuard.position(clubId, income.entriesOf(Income.class), false);
            ClubFinancials financials = new ClubFinancials(totalIncome, totalExpenses,
                    calculator.netProfit(totalIncome, totalExpenses),
                    position.getTotalAllocated(), position.getAvailableForAllocation());
            hierarchyStore.saveClubFinancials(clubId, financials);
            return financials;
        });
    }

    private NodeRecalculation run(RecomputeKey key, Supplier<Object> computation) {
        return locks.withLock(key, () -> {
            long start = System.currentTimeMillis();
            try {
                Object financials = Retry.decorateSupplier(retry, computation).get();
                metrics.recordRecompute(key.getLevel(), "fresh", System.currentTimeMillis() - start);
                return NodeRecalculation.fresh(key, financials);
            } catch (RuntimeException e) {
                log.error("Recompute of {} failed after retries, marking it stale: {}", key, e.getMessage());
                metrics.recordRecompute(key.getLevel(), "stale", System.currentTimeMillis() - start);
                metrics.recordStaleSummary(key.getLevel());
                markStale(key);
                return NodeRecalculation.stale(key, e.getMessage());
            }
        });
    }

    private void markStale(RecomputeKey key) {
        try {
            hierarchyStore.markStale(key.getLevel(), key.getNodeId());
        } catch (RuntimeException e) {
            // stale marking is best effort; the result still reports STALE
            log.error("Could not mark {} as stale: {}", key, e.getMessage());
        }
    }
}
