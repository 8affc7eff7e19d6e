package com.flagship.fundraising_ledger.support;

import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.CampaignFinancials;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.ClubFinancials;
import com.flagship.fundraising_ledger.hierarchy.EventFinancials;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.FundraisingHierarchyStore;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Clubs, campaigns and events held in insertion order. Saves of a given
 * level can be made to fail a number of times.
 */
public class InMemoryHierarchyStore implements FundraisingHierarchyStore {

    private final Map<UUID, Club> clubs = new LinkedHashMap<>();
    private final Map<UUID, Campaign> campaigns = new LinkedHashMap<>();
    private final Map<UUID, FundraisingEvent> events = new LinkedHashMap<>();
    private final Map<OwnershipLevel, AtomicInteger> failingSaves = new LinkedHashMap<>();
    private final AtomicInteger saveCalls = new AtomicInteger();

    public synchronized Club addClub(String name) {
        Club club = new Club(UUID.randomUUID(), name, ClubFinancials.empty(), SummaryStatus.FRESH, null);
        clubs.put(club.getId(), club);
        return club;
    }

    public synchronized Campaign addCampaign(UUID clubId, String name, String target) {
        Campaign campaign = new Campaign(UUID.randomUUID(), clubId, name, new BigDecimal(target),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31),
                CampaignFinancials.empty(), SummaryStatus.FRESH, null);
        campaigns.put(campaign.getId(), campaign);
        return campaign;
    }

    public synchronized FundraisingEvent addEvent(UUID clubId, UUID campaignId, String title, String goal) {
        FundraisingEvent event = new FundraisingEvent(UUID.randomUUID(), clubId, campaignId, title,
                new BigDecimal(goal), LocalDate.of(2024, 3, 1), EventFinancials.empty(), SummaryStatus.FRESH, null);
        events.put(event.getId(), event);
        return event;
    }

    public synchronized void failSaves(OwnershipLevel level, int times) {
        failingSaves.put(level, new AtomicInteger(times));
    }

    public int getSaveCalls() {
        return saveCalls.get();
    }

    @Override
    public synchronized Optional<Club> findClub(UUID clubId) {
        return Optional.ofNullable(clubs.get(clubId));
    }

    @Override
    public synchronized Optional<Campaign> findCampaign(UUID campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public synchronized Optional<FundraisingEvent> findEvent(UUID eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public synchronized List<Campaign> listCampaigns(UUID clubId) {
        return campaigns.values().stream().filter(c -> c.getClubId().equals(clubId)).toList();
    }

    @Override
    public synchronized List<FundraisingEvent> listEvents(UUID clubId) {
        return sortedEvents(events.values().stream().filter(e -> e.getClubId().equals(clubId)).toList());
    }

    @Override
    public synchronized List<FundraisingEvent> listEventsForCampaign(UUID campaignId) {
        return sortedEvents(events.values().stream().filter(e -> campaignId.equals(e.getCampaignId())).toList());
    }

    @Override
    public synchronized void saveEventFinancials(UUID eventId, EventFinancials financials) {
        checkSave(OwnershipLevel.EVENT);
        FundraisingEvent e = require(events.get(eventId), eventId);
        events.put(eventId, new FundraisingEvent(e.getId(), e.getClubId(), e.getCampaignId(), e.getTitle(),
                e.getGoalAmount(), e.getEventDate(), financials, SummaryStatus.FRESH, Instant.now()));
    }

    @Override
    public synchronized void saveCampaignFinancials(UUID campaignId, CampaignFinancials financials) {
        checkSave(OwnershipLevel.CAMPAIGN);
        Campaign c = require(campaigns.get(campaignId), campaignId);
        campaigns.put(campaignId, new Campaign(c.getId(), c.getClubId(), c.getName(), c.getTargetAmount(),
                c.getStartDate(), c.getEndDate(), financials, SummaryStatus.FRESH, Instant.now()));
    }

    @Override
    public synchronized void saveClubFinancials(UUID clubId, ClubFinancials financials) {
        checkSave(OwnershipLevel.CLUB);
        Club c = require(clubs.get(clubId), clubId);
        clubs.put(clubId, new Club(c.getId(), c.getName(), financials, SummaryStatus.FRESH, Instant.now()));
    }

    @Override
    public synchronized void markStale(OwnershipLevel level, UUID nodeId) {
        switch (level) {
            case CLUB -> {
                Club c = require(clubs.get(nodeId), nodeId);
                clubs.put(nodeId, new Club(c.getId(), c.getName(), c.getFinancials(),
                        SummaryStatus.STALE, c.getSummaryRefreshedAt()));
            }
            case CAMPAIGN -> {
                Campaign c = require(campaigns.get(nodeId), nodeId);
                campaigns.put(nodeId, new Campaign(c.getId(), c.getClubId(), c.getName(), c.getTargetAmount(),
                        c.getStartDate(), c.getEndDate(), c.getFinancials(),
                        SummaryStatus.STALE, c.getSummaryRefreshedAt()));
            }
            case EVENT -> {
                FundraisingEvent e = require(events.get(nodeId), nodeId);
                events.put(nodeId, new FundraisingEvent(e.getId(), e.getClubId(), e.getCampaignId(), e.getTitle(),
                        e.getGoalAmount(), e.getEventDate(), e.getFinancials(),
                        SummaryStatus.STALE, e.getSummaryRefreshedAt()));
            }
        }
    }

    private void checkSave(OwnershipLevel level) {
        saveCalls.incrementAndGet();
        AtomicInteger remaining = failingSaves.get(level);
        if (remaining != null && remaining.getAndDecrement() > 0) {
            throw new IllegalStateException("could not write " + level + " summary");
        }
    }

    private static List<FundraisingEvent> sortedEvents(List<FundraisingEvent> list) {
        List<FundraisingEvent> sorted = new ArrayList<>(list);
        sorted.sort(Comparator.comparing(FundraisingEvent::getEventDate, Comparator.reverseOrder())
                .thenComparing(FundraisingEvent::getId));
        return sorted;
    }

    private static <T> T require(T value, UUID id) {
        if (value == null) {
            throw new ResourceNotFoundException("No node " + id);
        }
        return value;
    }
}
