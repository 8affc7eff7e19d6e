package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.allocation.AllocationCheck;
import com.flagship.fundraising_ledger.allocation.AllocationEnforcement;
import com.flagship.fundraising_ledger.allocation.AllocationGuard;
import com.flagship.fundraising_ledger.exception.AllocationOverrunException;
import com.flagship.fundraising_ledger.exception.MutualExclusivityException;
import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.EntryScope;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.observability.CorrelationContext;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import com.flagship.fundraising_ledger.recalc.RecalculationCoordinator;
import com.flagship.fundraising_ledger.recalc.RecalculationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every income and expense change.
 *
 * A mutation runs in this order: validate, resolve the target node, check
 * allocations, store the entry with its notification, then recompute the
 * affected summaries. Validation always happens before any write. The
 * store step is transactional; the recompute runs afterwards and can only
 * leave summaries stale, never undo the entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEntryService {

    private final LedgerEntryValidator validator;
    private final HierarchyResolver hierarchyResolver;
    private final LedgerEntryPersistenceService persistence;
    private final AllocationGuard allocationGuard;
    private final RecalculationCoordinator coordinator;
    private final IdempotencyService idempotencyService;
    private final FinancialMetrics metrics;

    @Value("${allocation.enforcement:ADVISORY}")
    private AllocationEnforcement enforcement = AllocationEnforcement.ADVISORY;

    public LedgerMutationResult create(LedgerEntryDraft draft, String idempotencyKey) {
        CorrelationContext.putClub(draft.getOwnerClubId());
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();

        if (keyed) {
            Optional<LedgerEntry> previous = idempotencyService
                    .findEntryId(draft.getKind(), draft.getOwnerClubId(), idempotencyKey)
                    .flatMap(id -> persistence.find(draft.getKind(), id, draft.getOwnerClubId()));
            if (previous.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key {} already used, returning {} {}",
                        idempotencyKey, draft.getKind(), previous.get().getId());
                return LedgerMutationResult.replayed(previous.get());
            }
            metrics.recordIdempotencyMiss();
        }

        validate(draft);
        EntryScope scope = hierarchyResolver.resolveScope(
                draft.getOwnerClubId(), draft.getCampaignId(), draft.getEventId());

        Instant now = Instant.now();
        LedgerEntry entry = draft.toEntry(UUID.randomUUID(), now, now);
        CorrelationContext.putEntry(entry.getId());

        AllocationCheck check = null;
        if (entry instanceof Income && ((Income) entry).isAllocation()) {
            check = checkAllocation(entry.getOwnerClubId(), entry.getAmount());
        }

        persistence.create(entry, keyed ? idempotencyKey : null);
        if (keyed) {
            idempotencyService.remember(entry.getKind(), entry.getOwnerClubId(), idempotencyKey, entry.getId());
        }
        metrics.recordEntryMutation(entry.getKind(), "create", "success");
        log.info("Recorded {} {} of {} at {} level", entry.getKind(), entry.getId(), entry.getAmount(), entry.getLevel());

        RecalculationResult recalculation = coordinator.recalculate(scope);
        return new LedgerMutationResult(entry, recalculation, check, false);
    }

    /**
     * Applies a partial update. The entry's campaign or event cannot change;
     * naming a different one is rejected as a mutual exclusivity violation.
     */
    public LedgerMutationResult update(EntryKind kind, UUID entryId, UUID clubId, LedgerEntryPatch patch) {
        CorrelationContext.putClub(clubId);
        CorrelationContext.putEntry(entryId);

        LedgerEntry existing = get(kind, entryId, clubId);
        if (patch.reassigns(existing)) {
            metrics.recordValidationFailure(kind);
            throw new MutualExclusivityException(kind.getDisplayName()
                    + " cannot be moved to another campaign or event; delete it and record it again");
        }
        if (patch.isEmptyFor(kind)) {
            throw new IllegalArgumentException("No valid fields to update");
        }

        LedgerEntryDraft merged = patch.applyTo(LedgerEntryDraft.from(existing));
        validate(merged);
        LedgerEntry candidate = merged.toEntry(existing.getId(), existing.getCreatedAt(), Instant.now());

        AllocationCheck check = null;
        if (candidate instanceof Income && ((Income) candidate).isAllocation()) {
            BigDecimal previouslyAllocated = existing instanceof Income && ((Income) existing).isAllocation()
                    ? existing.getAmount() : BigDecimal.ZERO;
            BigDecimal increase = candidate.getAmount().subtract(previouslyAllocated);
            if (increase.signum() > 0) {
                check = checkAllocation(clubId, increase);
            }
        }

        LedgerEntry updated = persistence.update(existing, candidate);
        metrics.recordEntryMutation(kind, "update", "success");
        log.info("Updated {} {}: amount {} -> {}", kind, entryId, existing.getAmount(), updated.getAmount());

        RecalculationResult recalculation = coordinator.onEntryChanged(updated);
        return new LedgerMutationResult(updated, recalculation, check, false);
    }

    public LedgerMutationResult delete(EntryKind kind, UUID entryId, UUID clubId) {
        CorrelationContext.putClub(clubId);
        CorrelationContext.putEntry(entryId);

        LedgerEntry existing = get(kind, entryId, clubId);
        if (!persistence.delete(existing)) {
            throw notFound(kind, entryId);
        }
        metrics.recordEntryMutation(kind, "delete", "success");
        log.info("Deleted {} {} of {}", kind, entryId, existing.getAmount());

        RecalculationResult recalculation = coordinator.onEntryChanged(existing);
        return new LedgerMutationResult(existing, recalculation, null, false);
    }

    public LedgerEntry get(EntryKind kind, UUID entryId, UUID clubId) {
        return persistence.find(kind, entryId, clubId).orElseThrow(() -> notFound(kind, entryId));
    }

    /**
     * Entries attached directly to a club, campaign or event, newest first.
     */
    public List<LedgerEntry> listForNode(EntryKind kind, UUID clubId, UUID campaignId, UUID eventId) {
        EntryScope scope = hierarchyResolver.resolveScope(clubId, campaignId, eventId);
        return hierarchyResolver.fetchLevel(kind, scope.getLevel(), scope.getNodeId());
    }

    private void validate(LedgerEntryDraft draft) {
        ValidationResult result = validator.validate(draft);
        if (!result.isOk()) {
            metrics.recordValidationFailure(draft.getKind());
            log.info("Rejected {} draft: {}", draft.getKind(), result.getMessages());
            result.throwIfInvalid();
        }
    }

    private AllocationCheck checkAllocation(UUID clubId, BigDecimal amount) {
        AllocationCheck check = allocationGuard.checkAllocation(clubId, amount);
        if (!check.isCanAllocate()) {
            if (enforcement == AllocationEnforcement.STRICT) {
                log.warn("Rejecting allocation of {} for club {}: {}", amount, clubId, check.getWarning());
                throw new AllocationOverrunException(check);
            }
            log.warn("Allocation of {} for club {} exceeds available funds: {}", amount, clubId, check.getWarning());
        }
        return check;
    }

    private static ResourceNotFoundException notFound(EntryKind kind, UUID entryId) {
        return new ResourceNotFoundException(kind.getDisplayName() + " record not found: " + entryId);
    }

    void setEnforcement(AllocationEnforcement enforcement) {
        this.enforcement = enforcement;
    }
}
