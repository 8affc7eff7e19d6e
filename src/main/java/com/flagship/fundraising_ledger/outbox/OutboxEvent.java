package com.flagship.fundraising_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A financial change notification waiting in the outbox.
 *
 * Written in the same transaction as the ledger or summary change it
 * describes, and published to Kafka later by {@link OutboxPublisher}.
 * All fundraising notifications use the club as their aggregate, so the
 * Kafka key is the club id and a club's changes stay in order.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // always "Club" today
    UUID aggregateId;          // club id
    String eventType;          // e.g. "IncomeRecorded", "CampaignFinancialsUpdated"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until sent
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database sequence
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once the publisher has given up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
