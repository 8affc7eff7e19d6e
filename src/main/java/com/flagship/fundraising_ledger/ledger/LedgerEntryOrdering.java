package com.flagship.fundraising_ledger.ledger;

import java.time.Instant;
import java.util.Comparator;

/**
 * Deterministic list order for entries: newest date first, then newest
 * creation time, then id.
 */
public final class LedgerEntryOrdering {

    public static final Comparator<LedgerEntry> NEWEST_FIRST = Comparator
            .comparing(LedgerEntry::getDate, Comparator.reverseOrder())
            .thenComparing(LedgerEntry::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(LedgerEntry::getId);

    private LedgerEntryOrdering() {
    }
}
