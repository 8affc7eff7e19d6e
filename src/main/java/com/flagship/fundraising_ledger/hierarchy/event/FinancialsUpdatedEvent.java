package com.flagship.fundraising_ledger.hierarchy.event;

import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A node's derived totals were recomputed and stored.
 *
 * The event type is "EventFinancialsUpdated", "CampaignFinancialsUpdated"
 * or "ClubFinancialsUpdated" depending on the level.
 */
@Value
public class FinancialsUpdatedEvent {
    UUID eventId;
    UUID clubId;
    OwnershipLevel level;
    UUID nodeId;
    Object financials;
    Instant occurredAt;

    public String getEventType() {
        return switch (level) {
            case EVENT -> "EventFinancialsUpdated";
            case CAMPAIGN -> "CampaignFinancialsUpdated";
            case CLUB -> "ClubFinancialsUpdated";
        };
    }

    public static FinancialsUpdatedEvent of(UUID clubId, OwnershipLevel level, UUID nodeId, Object financials) {
        return new FinancialsUpdatedEvent(UUID.randomUUID(), clubId, level, nodeId, financials, Instant.now());
    }
}
