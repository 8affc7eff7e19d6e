package com.flagship.fundraising_ledger.recalc;

import com.flagship.fundraising_ledger.ledger.ClubAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Manual recompute of stored summaries, e.g. to clear a STALE marker.
 * Calling it repeatedly without ledger changes stores the same values.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RecalculationController {

    private final RecalculationCoordinator coordinator;

    @PostMapping("/events/{eventId}/financials/recalculate")
    public RecalculationResult recalculateEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        log.info("Manual recompute requested for event {}", eventId);
        return coordinator.recalculateEvent(clubId, eventId);
    }

    @PostMapping("/campaigns/{campaignId}/financials/recalculate")
    public RecalculationResult recalculateCampaign(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        log.info("Manual recompute requested for campaign {}", campaignId);
        return coordinator.recalculateCampaign(clubId, campaignId);
    }

    @PostMapping("/clubs/{clubId}/financials/recalculate")
    public RecalculationResult recalculateClub(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        log.info("Manual recompute requested for club {}", clubId);
        return coordinator.recalculateClub(clubId);
    }
}
