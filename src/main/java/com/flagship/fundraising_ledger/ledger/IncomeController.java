package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.ledger.dto.IncomeRequest;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fundraising_ledger.ledger.dto.LedgerMutationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Income records at club, campaign and event level.
 *
 * Every route needs the X-Club-Id header. Creates accept an optional
 * Idempotency-Key; a repeated key returns the first entry with 200 instead
 * of 201.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class IncomeController {

    private final LedgerEntryService ledgerEntryService;

    @PostMapping("/clubs/{clubId}/income")
    public ResponseEntity<LedgerMutationResponse> createClubIncome(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody IncomeRequest request) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return created(ledgerEntryService.create(
                request.toDraft(clubId, request.getCampaignId(), request.getEventId()), idempotencyKey));
    }

    @GetMapping("/clubs/{clubId}/income")
    public List<LedgerEntryResponse> listClubIncome(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return toResponses(ledgerEntryService.listForNode(EntryKind.INCOME, clubId, null, null));
    }

    @PostMapping("/campaigns/{campaignId}/income")
    public ResponseEntity<LedgerMutationResponse> createCampaignIncome(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody IncomeRequest request) {
        return created(ledgerEntryService.create(
                request.toDraft(clubId, campaignId, request.getEventId()), idempotencyKey));
    }

    @GetMapping("/campaigns/{campaignId}/income")
    public List<LedgerEntryResponse> listCampaignIncome(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return toResponses(ledgerEntryService.listForNode(EntryKind.INCOME, clubId, campaignId, null));
    }

    @PostMapping("/events/{eventId}/income")
    public ResponseEntity<LedgerMutationResponse> createEventIncome(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody IncomeRequest request) {
        return created(ledgerEntryService.create(
                request.toDraft(clubId, request.getCampaignId(), eventId), idempotencyKey));
    }

    @GetMapping("/events/{eventId}/income")
    public List<LedgerEntryResponse> listEventIncome(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return toResponses(ledgerEntryService.listForNode(EntryKind.INCOME, clubId, null, eventId));
    }

    @GetMapping("/income/{id}")
    public LedgerEntryResponse getIncome(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return LedgerEntryResponse.from(ledgerEntryService.get(EntryKind.INCOME, id, clubId));
    }

    @PutMapping("/income/{id}")
    public LedgerMutationResponse updateIncome(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestBody IncomeRequest request) {
        return LedgerMutationResponse.from(
                ledgerEntryService.update(EntryKind.INCOME, id, clubId, request.toPatch()));
    }

    @DeleteMapping("/income/{id}")
    public LedgerMutationResponse deleteIncome(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return LedgerMutationResponse.from(ledgerEntryService.delete(EntryKind.INCOME, id, clubId));
    }

    static ResponseEntity<LedgerMutationResponse> created(LedgerMutationResult result) {
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(LedgerMutationResponse.from(result));
    }

    static List<LedgerEntryResponse> toResponses(List<LedgerEntry> entries) {
        return entries.stream().map(LedgerEntryResponse::from).toList();
    }
}
