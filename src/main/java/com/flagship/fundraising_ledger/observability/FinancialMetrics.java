package com.flagship.fundraising_ledger.observability;

import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for the rollup engine.
 *
 * Meters:
 * - ledger.entries.mutations: create/update/delete by kind and outcome
 * - ledger.entries.validation_failures: rejected drafts by kind
 * - rollup.recompute.duration: node recompute time by level and outcome
 * - rollup.recompute.retries: retry attempts of node recomputes
 * - rollup.summaries.stale: nodes marked stale after exhausted retries
 * - rollup.fetch.failures: failed sub-fetches during club-wide collection
 * - rollup.fetch.malformed: stored rows dropped for unreadable amounts
 * - allocation.checks: allocation checks by result
 * - idempotency.cache: replayed vs new creates
 */
@Component
public class FinancialMetrics {

    private final MeterRegistry registry;

    public FinancialMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEntryMutation(EntryKind kind, String operation, String outcome) {
        registry.counter("ledger.entries.mutations",
                "kind", tag(kind.name()),
                "operation", tag(operation),
                "outcome", tag(outcome)
        ).increment();
    }

    public void recordValidationFailure(EntryKind kind) {
        registry.counter("ledger.entries.validation_failures", "kind", tag(kind.name())).increment();
    }

    public void recordRecompute(OwnershipLevel level, String outcome, long durationMs) {
        registry.timer("rollup.recompute.duration",
                "level", tag(level.name()),
                "outcome", tag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRecomputeRetry() {
        registry.counter("rollup.recompute.retries").increment();
    }

    public void recordStaleSummary(OwnershipLevel level) {
        registry.counter("rollup.summaries.stale", "level", tag(level.name())).increment();
    }

    public void recordSubFetchFailure(OwnershipLevel level) {
        registry.counter("rollup.fetch.failures", "level", tag(level.name())).increment();
    }

    public void recordMalformedRecords(EntryKind kind, int count) {
        if (count > 0) {
            registry.counter("rollup.fetch.malformed", "kind", tag(kind.name())).increment(count);
        }
    }

    public void recordAllocationCheck(boolean canAllocate) {
        registry.counter("allocation.checks", "result", canAllocate ? "within_budget" : "overrun").increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values to a small, safe alphabet to bound cardinality.
     */
    private String tag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
