package com.flagship.fundraising_ledger.ledger.event;

import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A new income or expense entry was stored.
 */
@Value
public class LedgerEntryRecordedEvent implements LedgerEntryEvent {
    UUID eventId;
    UUID entryId;
    UUID clubId;
    EntryKind kind;
    OwnershipLevel level;
    UUID nodeId;
    String label;
    BigDecimal amount;
    LocalDate date;
    String paymentMethod;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return kind.getDisplayName() + "Recorded";
    }

    public static LedgerEntryRecordedEvent from(LedgerEntry entry) {
        return new LedgerEntryRecordedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getOwnerClubId(),
            entry.getKind(),
            entry.getLevel(),
            entry.getNodeId(),
            entry.getLabel(),
            entry.getAmount(),
            entry.getDate(),
            entry.getPaymentMethodCode(),
            Instant.now()
        );
    }
}
