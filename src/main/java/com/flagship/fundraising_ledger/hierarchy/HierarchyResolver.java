package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.exception.InvalidAmountException;
import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.LedgerEntryMapper;
import com.flagship.fundraising_ledger.ledger.LedgerEntryOrdering;
import com.flagship.fundraising_ledger.ledger.LedgerRecordStore;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.ledger.StoredEntry;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Works out where entries sit in the club / campaign / event hierarchy and
 * gathers them for rollups.
 *
 * Club-wide collection issues one fetch for the club's own entries and one
 * per campaign and per event. Fetches run on the rollup executor in batches
 * of at most rollup.fetch.concurrency, each bounded by
 * rollup.fetch.timeout-ms. A failed, timed out or rejected fetch never
 * fails the collection: it contributes no entries and the result is
 * flagged partial. Timed out fetches are interrupted.
 */
@Component
@Slf4j
public class HierarchyResolver {

    private final LedgerRecordStore recordStore;
    private final FundraisingHierarchyStore hierarchyStore;
    private final LedgerEntryMapper mapper;
    private final Executor fetchExecutor;
    private final FinancialMetrics metrics;
    private final int concurrency;
    private final long timeoutMs;

    public HierarchyResolver(LedgerRecordStore recordStore,
                             FundraisingHierarchyStore hierarchyStore,
                             LedgerEntryMapper mapper,
                             @Qualifier("rollupFetchExecutor") Executor fetchExecutor,
                             FinancialMetrics metrics,
                             @Value("${rollup.fetch.concurrency:5}") int concurrency,
                             @Value("${rollup.fetch.timeout-ms:5000}") long timeoutMs) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("rollup.fetch.concurrency must be at least 1");
        }
        this.recordStore = recordStore;
        this.hierarchyStore = hierarchyStore;
        this.mapper = mapper;
        this.fetchExecutor = fetchExecutor;
        this.metrics = metrics;
        this.concurrency = concurrency;
        this.timeoutMs = timeoutMs;
    }

    public OwnershipLevel classify(LedgerEntry entry) {
        return OwnershipLevel.of(entry.getCampaignId(), entry.getEventId());
    }

    /**
     * Checks that the referenced node exists and belongs to the club.
     *
     * @throws ResourceNotFoundException if the club, campaign or event is
     *         unknown or owned by another club
     */
    public EntryScope resolveScope(UUID clubId, UUID campaignId, UUID eventId) {
        if (campaignId != null && eventId != null) {
            throw new IllegalArgumentException("An entry scope cannot name both a campaign and an event");
        }
        if (eventId != null) {
            FundraisingEvent event = requireEvent(clubId, eventId);
            return EntryScope.event(clubId, eventId, event.getCampaignId());
        }
        if (campaignId != null) {
            requireCampaign(clubId, campaignId);
            return EntryScope.campaign(clubId, campaignId);
        }
        hierarchyStore.findClub(clubId)
                .orElseThrow(() -> new ResourceNotFoundException("Club not found: " + clubId));
        return EntryScope.club(clubId);
    }

    /**
     * Scope of an entry that already exists. Does not fail when an event has
     * gone; the campaign above it is then unknown and left out.
     */
    public EntryScope scopeOf(LedgerEntry entry) {
        return switch (classify(entry)) {
            case EVENT -> EntryScope.event(entry.getOwnerClubId(), entry.getEventId(),
                    hierarchyStore.findEvent(entry.getEventId())
                            .map(FundraisingEvent::getCampaignId)
                            .orElse(null));
            case CAMPAIGN -> EntryScope.campaign(entry.getOwnerClubId(), entry.getCampaignId());
            case CLUB -> EntryScope.club(entry.getOwnerClubId());
        };
    }

    public FundraisingEvent requireEvent(UUID clubId, UUID eventId) {
        return hierarchyStore.findEvent(eventId)
                .filter(event -> event.getClubId().equals(clubId))
                .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + eventId));
    }

    public Campaign requireCampaign(UUID clubId, UUID campaignId) {
        return hierarchyStore.findCampaign(campaignId)
                .filter(campaign -> campaign.getClubId().equals(clubId))
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + campaignId));
    }

    /**
     * Entries attached directly to one node, newest first. Unlike club-wide
     * collection this fails outright, including on a malformed amount.
     */
    public List<LedgerEntry> fetchLevel(EntryKind kind, OwnershipLevel level, UUID nodeId) {
        return fetchRaw(kind, level, nodeId).stream()
                .map(mapper::toEntry)
                .sorted(LedgerEntryOrdering.NEWEST_FIRST)
                .toList();
    }

    public ClubWideEntries collectClubWideEntries(UUID clubId, EntryKind kind) {
        return collectClubWideEntries(clubId, kind,
                hierarchyStore.listCampaigns(clubId),
                hierarchyStore.listEvents(clubId));
    }

    public ClubWideEntries collectClubWideEntries(UUID clubId, EntryKind kind,
                                                  List<Campaign> campaigns,
                                                  List<FundraisingEvent> events) {
        List<FetchTarget> targets = new ArrayList<>();
        targets.add(new FetchTarget(OwnershipLevel.CLUB, clubId));
        campaigns.forEach(c -> targets.add(new FetchTarget(OwnershipLevel.CAMPAIGN, c.getId())));
        events.forEach(e -> targets.add(new FetchTarget(OwnershipLevel.EVENT, e.getId())));

        List<ClubWideEntries.FailedScope> failures = new ArrayList<>();
        Map<UUID, LedgerEntry> byId = new LinkedHashMap<>();
        int malformed = 0;

        for (int start = 0; start < targets.size(); start += concurrency) {
            List<FetchTarget> batch = targets.subList(start, Math.min(start + concurrency, targets.size()));
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            List<FutureTask<List<StoredEntry>>> tasks = new ArrayList<>(batch.size());
            for (FetchTarget target : batch) {
                tasks.add(submit(target, kind, failures));
            }

            for (int i = 0; i < batch.size(); i++) {
                FutureTask<List<StoredEntry>> task = tasks.get(i);
                if (task == null) {
                    continue;
                }
                FetchTarget target = batch.get(i);
                Optional<List<StoredEntry>> rows = await(task, deadline, target, kind, failures);
                if (rows.isEmpty()) {
                    continue;
                }
                for (StoredEntry row : rows.get()) {
                    try {
                        byId.putIfAbsent(row.getId(), mapper.toEntry(row));
                    } catch (InvalidAmountException e) {
                        malformed++;
                        log.warn("Dropping {} {} of club {}: {}", kind, row.getId(), clubId, e.getMessage());
                    }
                }
            }
        }

        metrics.recordMalformedRecords(kind, malformed);
        List<LedgerEntry> entries = byId.values().stream()
                .sorted(LedgerEntryOrdering.NEWEST_FIRST)
                .toList();
        if (!failures.isEmpty()) {
            log.warn("Club {} {} collection is partial: {} of {} sub-fetches failed",
                    clubId, kind, failures.size(), targets.size());
        }
        return new ClubWideEntries(clubId, kind, entries, List.copyOf(failures), malformed);
    }

    /**
     * Hands one fetch to the pool. A saturated pool counts the scope as
     * failed and returns null.
     */
    private FutureTask<List<StoredEntry>> submit(FetchTarget target, EntryKind kind,
                                                 List<ClubWideEntries.FailedScope> failures) {
        FutureTask<List<StoredEntry>> task =
                new FutureTask<>(() -> fetchRaw(kind, target.level(), target.nodeId()));
        try {
            fetchExecutor.execute(task);
            return task;
        } catch (RejectedExecutionException e) {
            recordFailure(target, kind, "rejected, fetch pool is saturated", failures);
            return null;
        }
    }

    /**
     * Waits until the batch deadline. A fetch still running then is
     * cancelled with an interrupt so its pool thread is released.
     */
    private Optional<List<StoredEntry>> await(FutureTask<List<StoredEntry>> task, long deadline,
                                              FetchTarget target, EntryKind kind,
                                              List<ClubWideEntries.FailedScope> failures) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return Optional.of(task.get(remaining, TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            recordFailure(target, kind, "interrupted", failures);
        } catch (TimeoutException e) {
            task.cancel(true);
            recordFailure(target, kind, "timed out after " + timeoutMs + "ms", failures);
        } catch (CancellationException e) {
            recordFailure(target, kind, "cancelled", failures);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(target, kind, String.valueOf(cause.getMessage()), failures);
        }
        return Optional.empty();
    }

    private void recordFailure(FetchTarget target, EntryKind kind, String reason,
                               List<ClubWideEntries.FailedScope> failures) {
        log.warn("Fetching {} for {} {} failed, counting it as empty: {}",
                kind, target.level(), target.nodeId(), reason);
        metrics.recordSubFetchFailure(target.level());
        failures.add(new ClubWideEntries.FailedScope(target.level(), target.nodeId(), reason));
    }

    private List<StoredEntry> fetchRaw(EntryKind kind, OwnershipLevel level, UUID nodeId) {
        return switch (level) {
            case CLUB -> recordStore.listEntriesForClub(kind, nodeId);
            case CAMPAIGN -> recordStore.listEntriesForCampaign(kind, nodeId);
            case EVENT -> recordStore.listEntriesForEvent(kind, nodeId);
        };
    }

    private record FetchTarget(OwnershipLevel level, UUID nodeId) {
    }
}
