package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.ledger.event.LedgerEntryDeletedEvent;
import com.flagship.fundraising_ledger.ledger.event.LedgerEntryEvent;
import com.flagship.fundraising_ledger.ledger.event.LedgerEntryRecordedEvent;
import com.flagship.fundraising_ledger.ledger.event.LedgerEntryUpdatedEvent;
import com.flagship.fundraising_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Transactional writes of ledger entries.
 *
 * Each write and its change notification commit in one transaction. The
 * summary recompute that follows runs after this commit, in its own
 * transactions, so a failed recompute can never undo the entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEntryPersistenceService {

    private final LedgerRecordStore recordStore;
    private final LedgerEntryMapper mapper;
    private final OutboxService outboxService;

    @Transactional
    public LedgerEntry create(LedgerEntry entry, String idempotencyKey) {
        recordStore.createEntry(mapper.toStored(entry, idempotencyKey));
        notify(entry.getOwnerClubId(), LedgerEntryRecordedEvent.from(entry));
        log.debug("Stored {} {} at {} level", entry.getKind(), entry.getId(), entry.getLevel());
        return entry;
    }

    @Transactional
    public LedgerEntry update(LedgerEntry before, LedgerEntry after) {
        StoredEntry stored = recordStore.updateEntry(mapper.toStored(after, null))
                .orElseThrow(() -> new IllegalStateException(
                        after.getKind().getDisplayName() + " " + after.getId() + " disappeared during update"));
        LedgerEntry updated = mapper.toEntry(stored);
        notify(updated.getOwnerClubId(), LedgerEntryUpdatedEvent.from(before, updated));
        return updated;
    }

    @Transactional
    public boolean delete(LedgerEntry entry) {
        boolean deleted = recordStore.deleteEntry(entry.getKind(), entry.getId(), entry.getOwnerClubId());
        if (deleted) {
            notify(entry.getOwnerClubId(), LedgerEntryDeletedEvent.from(entry));
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> find(EntryKind kind, UUID entryId, UUID clubId) {
        return recordStore.findEntry(kind, entryId, clubId).map(mapper::toEntry);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByIdempotencyKey(EntryKind kind, UUID clubId, String idempotencyKey) {
        return recordStore.findByIdempotencyKey(kind, clubId, idempotencyKey).map(mapper::toEntry);
    }

    private void notify(UUID clubId, LedgerEntryEvent event) {
        outboxService.saveClubEvent(clubId, event.getEventType(), event);
    }
}
