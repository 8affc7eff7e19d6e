package com.flagship.fundraising_ledger.ledger.event;

import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An existing entry was changed. Carries the amount before and after so
 * consumers can see the delta without re-reading the ledger.
 */
@Value
public class LedgerEntryUpdatedEvent implements LedgerEntryEvent {
    UUID eventId;
    UUID entryId;
    UUID clubId;
    EntryKind kind;
    OwnershipLevel level;
    UUID nodeId;
    BigDecimal previousAmount;
    BigDecimal amount;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return kind.getDisplayName() + "Updated";
    }

    public static LedgerEntryUpdatedEvent from(LedgerEntry before, LedgerEntry after) {
        return new LedgerEntryUpdatedEvent(
            UUID.randomUUID(),
            after.getId(),
            after.getOwnerClubId(),
            after.getKind(),
            after.getLevel(),
            after.getNodeId(),
            before.getAmount(),
            after.getAmount(),
            Instant.now()
        );
    }
}
