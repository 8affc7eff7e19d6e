package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.hierarchy.event.FinancialsUpdatedEvent;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed hierarchy store.
 *
 * Each save runs in its own transaction and writes a FinancialsUpdated
 * notification to the outbox in that same transaction, so a summary
 * change and its notification commit together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaFundraisingHierarchyStore implements FundraisingHierarchyStore {

    private final ClubRepository clubRepository;
    private final CampaignRepository campaignRepository;
    private final EventRepository eventRepository;
    private final OutboxService outboxService;

    @Override
    @Transactional(readOnly = true)
    public Optional<Club> findClub(UUID clubId) {
        return clubRepository.findById(clubId).map(ClubEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Campaign> findCampaign(UUID campaignId) {
        return campaignRepository.findById(campaignId).map(CampaignEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FundraisingEvent> findEvent(UUID eventId) {
        return eventRepository.findById(eventId).map(EventEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Campaign> listCampaigns(UUID clubId) {
        return campaignRepository.findByClubIdOrderByCreatedAtAscIdAsc(clubId).stream()
                .map(CampaignEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FundraisingEvent> listEvents(UUID clubId) {
        return eventRepository.findByClubIdOrderByEventDateDescIdAsc(clubId).stream()
                .map(EventEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FundraisingEvent> listEventsForCampaign(UUID campaignId) {
        return eventRepository.findByCampaignIdOrderByEventDateDescIdAsc(campaignId).stream()
                .map(EventEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void saveEventFinancials(UUID eventId, EventFinancials financials) {
        EventEntity event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + eventId));
        event.applyFinancials(financials);
        eventRepository.save(event);
        publish(event.getClubId(), OwnershipLevel.EVENT, eventId, financials);
    }

    @Override
    @Transactional
    public void saveCampaignFinancials(UUID campaignId, CampaignFinancials financials) {
        CampaignEntity campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + campaignId));
        campaign.applyFinancials(financials);
        campaignRepository.save(campaign);
        publish(campaign.getClubId(), OwnershipLevel.CAMPAIGN, campaignId, financials);
    }

    @Override
    @Transactional
    public void saveClubFinancials(UUID clubId, ClubFinancials financials) {
        ClubEntity club = clubRepository.findById(clubId)
                .orElseThrow(() -> new ResourceNotFoundException("Club not found: " + clubId));
        club.applyFinancials(financials);
        clubRepository.save(club);
        publish(clubId, OwnershipLevel.CLUB, clubId, financials);
    }

    @Override
    @Transactional
    public void markStale(OwnershipLevel level, UUID nodeId) {
        switch (level) {
            case EVENT -> eventRepository.findById(nodeId).ifPresent(e -> {
                e.markStale();
                eventRepository.save(e);
            });
            case CAMPAIGN -> campaignRepository.findById(nodeId).ifPresent(c -> {
                c.markStale();
                campaignRepository.save(c);
            });
            case CLUB -> clubRepository.findById(nodeId).ifPresent(c -> {
                c.markStale();
                clubRepository.save(c);
            });
        }
        log.warn("Marked {} {} summary as STALE", level, nodeId);
    }

    private void publish(UUID clubId, OwnershipLevel level, UUID nodeId, Object financials) {
        FinancialsUpdatedEvent event = FinancialsUpdatedEvent.of(clubId, level, nodeId, financials);
        outboxService.saveClubEvent(clubId, event.getEventType(), event);
    }
}
