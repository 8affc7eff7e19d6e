package com.flagship.fundraising_ledger.ledger;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for income and expense rows.
 *
 * The list methods return only the entries directly attached to the given
 * node: {@link #listEntriesForClub} returns club-level entries, not the
 * entries of the club's campaigns or events.
 */
public interface LedgerRecordStore {

    StoredEntry createEntry(StoredEntry entry);

    /**
     * @return the updated row, or empty if no such entry belongs to the club
     */
    Optional<StoredEntry> updateEntry(StoredEntry entry);

    boolean deleteEntry(EntryKind kind, UUID entryId, UUID clubId);

    Optional<StoredEntry> findEntry(EntryKind kind, UUID entryId, UUID clubId);

    Optional<StoredEntry> findByIdempotencyKey(EntryKind kind, UUID clubId, String idempotencyKey);

    List<StoredEntry> listEntriesForClub(EntryKind kind, UUID clubId);

    List<StoredEntry> listEntriesForCampaign(EntryKind kind, UUID campaignId);

    List<StoredEntry> listEntriesForEvent(EntryKind kind, UUID eventId);
}
