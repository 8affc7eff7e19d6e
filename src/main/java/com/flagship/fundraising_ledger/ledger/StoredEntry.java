package com.flagship.fundraising_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A ledger row as the record store returns it.
 *
 * The amount stays a string here; it only becomes a number through
 * {@link MoneyUtil#coerce(Object)} in {@link LedgerEntryMapper}.
 */
@Value
@Builder(toBuilder = true)
public class StoredEntry {
    UUID id;
    EntryKind kind;
    UUID clubId;
    UUID campaignId;
    UUID eventId;
    String label;
    String description;
    String amount;
    LocalDate date;
    String paymentMethod;
    String status;
    String reference;
    String vendor;
    String receiptUrl;
    String createdBy;
    String idempotencyKey;
    Instant createdAt;
    Instant updatedAt;
}
