package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Every entry of one kind across a club, its campaigns and its events.
 *
 * A sub-fetch that failed contributes nothing and is listed in
 * failedScopes; rows with unreadable amounts are dropped and counted in
 * malformedRecords. Either makes the result partial, and a partial result
 * must not be stored as a summary.
 */
@Value
public class ClubWideEntries {
    UUID clubId;
    EntryKind kind;
    List<LedgerEntry> entries;
    List<FailedScope> failedScopes;
    int malformedRecords;

    public boolean isPartial() {
        return !failedScopes.isEmpty() || malformedRecords > 0;
    }

    public <T extends LedgerEntry> List<T> entriesOf(Class<T> type) {
        return entries.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Value
    public static class FailedScope {
        OwnershipLevel level;
        UUID nodeId;
        String reason;
    }
}
