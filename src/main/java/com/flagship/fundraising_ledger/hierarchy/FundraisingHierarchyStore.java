package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.OwnershipLevel;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to clubs, campaigns and events, and write access to their
 * derived financial fields only.
 *
 * Campaign lists are ordered by creation time, event lists by event date
 * (newest first), both with id as the final tie-break.
 */
public interface FundraisingHierarchyStore {

    Optional<Club> findClub(UUID clubId);

    Optional<Campaign> findCampaign(UUID campaignId);

    Optional<FundraisingEvent> findEvent(UUID eventId);

    List<Campaign> listCampaigns(UUID clubId);

    List<FundraisingEvent> listEvents(UUID clubId);

    List<FundraisingEvent> listEventsForCampaign(UUID campaignId);

    /**
     * Stores an event's recomputed totals and marks them fresh.
     */
    void saveEventFinancials(UUID eventId, EventFinancials financials);

    void saveCampaignFinancials(UUID campaignId, CampaignFinancials financials);

    void saveClubFinancials(UUID clubId, ClubFinancials financials);

    /**
     * Flags a node's stored totals as out of date. Totals are left as they were.
     */
    void markStale(OwnershipLevel level, UUID nodeId);
}
