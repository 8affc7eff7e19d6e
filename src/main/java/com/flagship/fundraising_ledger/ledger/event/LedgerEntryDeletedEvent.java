package com.flagship.fundraising_ledger.ledger.event;

import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class LedgerEntryDeletedEvent implements LedgerEntryEvent {
    UUID eventId;
    UUID entryId;
    UUID clubId;
    EntryKind kind;
    OwnershipLevel level;
    UUID nodeId;
    BigDecimal amount;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return kind.getDisplayName() + "Deleted";
    }

    public static LedgerEntryDeletedEvent from(LedgerEntry entry) {
        return new LedgerEntryDeletedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getOwnerClubId(),
            entry.getKind(),
            entry.getLevel(),
            entry.getNodeId(),
            entry.getAmount(),
            Instant.now()
        );
    }
}
