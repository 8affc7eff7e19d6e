package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.allocation.AllocationCheck;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.recalc.RecalculationResult;
import lombok.Value;

/**
 * What a create, update or delete did: the entry (as stored, or as it was
 * before deletion), the summary recompute it triggered, and the allocation
 * check when the entry was an allocation.
 *
 * A replayed create (same Idempotency-Key) carries no recalculation.
 */
@Value
public class LedgerMutationResult {
    LedgerEntry entry;
    RecalculationResult recalculation;
    AllocationCheck allocationCheck;
    boolean replayed;

    public static LedgerMutationResult replayed(LedgerEntry entry) {
        return new LedgerMutationResult(entry, null, null, true);
    }

    public SummaryStatus getSummaryStatus() {
        return recalculation != null ? recalculation.getSummaryStatus() : SummaryStatus.FRESH;
    }

    public String getAllocationWarning() {
        return allocationCheck != null ? allocationCheck.getWarning() : null;
    }
}
