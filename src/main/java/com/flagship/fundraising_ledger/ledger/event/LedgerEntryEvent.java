package com.flagship.fundraising_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Change notification for an income or expense entry, written to the
 * outbox in the same transaction as the change.
 */
public interface LedgerEntryEvent {

    /**
     * Unique id of this notification, for consumer deduplication.
     */
    UUID getEventId();

    UUID getEntryId();

    UUID getClubId();

    Instant getOccurredAt();

    /**
     * e.g. "IncomeRecorded", "ExpenseDeleted".
     */
    String getEventType();
}
