package com.flagship.fundraising_ledger.hierarchy;

/**
 * Whether a node's derived totals reflect its current entries.
 *
 * STALE means the last recompute failed after all retries; the stored
 * totals are from an earlier successful recompute and a UI should show
 * them as recalculating.
 */
public enum SummaryStatus {
    FRESH,
    STALE
}
