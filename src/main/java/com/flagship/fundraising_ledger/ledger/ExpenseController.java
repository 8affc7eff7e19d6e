package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.ledger.dto.ExpenseRequest;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fundraising_ledger.ledger.dto.LedgerMutationResponse;
import lombok.RequiredArgsConstructor;
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
 * Expense records at club, campaign and event level. X-User-Id, when sent,
 * is stored as the expense's creator.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExpenseController {

    private final LedgerEntryService ledgerEntryService;

    @PostMapping("/clubs/{clubId}/expenses")
    public ResponseEntity<LedgerMutationResponse> createClubExpense(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestHeader(value = ClubAccess.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody ExpenseRequest request) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return IncomeController.created(ledgerEntryService.create(
                request.toDraft(clubId, request.getCampaignId(), request.getEventId(), userId), idempotencyKey));
    }

    @GetMapping("/clubs/{clubId}/expenses")
    public List<LedgerEntryResponse> listClubExpenses(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return IncomeController.toResponses(ledgerEntryService.listForNode(EntryKind.EXPENSE, clubId, null, null));
    }

    @PostMapping("/campaigns/{campaignId}/expenses")
    public ResponseEntity<LedgerMutationResponse> createCampaignExpense(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody ExpenseRequest request) {
        return IncomeController.created(ledgerEntryService.create(
                request.toDraft(clubId, campaignId, request.getEventId(), userId), idempotencyKey));
    }

    @GetMapping("/campaigns/{campaignId}/expenses")
    public List<LedgerEntryResponse> listCampaignExpenses(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return IncomeController.toResponses(
                ledgerEntryService.listForNode(EntryKind.EXPENSE, clubId, campaignId, null));
    }

    @PostMapping("/events/{eventId}/expenses")
    public ResponseEntity<LedgerMutationResponse> createEventExpense(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody ExpenseRequest request) {
        return IncomeController.created(ledgerEntryService.create(
                request.toDraft(clubId, request.getCampaignId(), eventId, userId), idempotencyKey));
    }

    @GetMapping("/events/{eventId}/expenses")
    public List<LedgerEntryResponse> listEventExpenses(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return IncomeController.toResponses(ledgerEntryService.listForNode(EntryKind.EXPENSE, clubId, null, eventId));
    }

    @GetMapping("/expenses/{id}")
    public LedgerEntryResponse getExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return LedgerEntryResponse.from(ledgerEntryService.get(EntryKind.EXPENSE, id, clubId));
    }

    @PutMapping("/expenses/{id}")
    public LedgerMutationResponse updateExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestBody ExpenseRequest request) {
        return LedgerMutationResponse.from(
                ledgerEntryService.update(EntryKind.EXPENSE, id, clubId, request.toPatch()));
    }

    @DeleteMapping("/expenses/{id}")
    public LedgerMutationResponse deleteExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId) {
        return LedgerMutationResponse.from(ledgerEntryService.delete(EntryKind.EXPENSE, id, clubId));
    }
}
