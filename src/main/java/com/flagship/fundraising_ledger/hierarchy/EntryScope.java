package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.util.UUID;

/**
 * The node an entry is attached to, plus the campaign above it when the
 * node is an event inside a campaign. Determines which summaries a change
 * must recompute.
 */
@Value
public class EntryScope {
    UUID clubId;
    OwnershipLevel level;
    UUID nodeId;
    UUID parentCampaignId;

    public static EntryScope club(UUID clubId) {
        return new EntryScope(clubId, OwnershipLevel.CLUB, clubId, null);
    }

    public static EntryScope campaign(UUID clubId, UUID campaignId) {
        return new EntryScope(clubId, OwnershipLevel.CAMPAIGN, campaignId, null);
    }

    public static EntryScope event(UUID clubId, UUID eventId, UUID parentCampaignId) {
        return new EntryScope(clubId, OwnershipLevel.EVENT, eventId, parentCampaignId);
    }
}
