package com.flagship.fundraising_ledger.allocation;

import com.flagship.fundraising_ledger.allocation.dto.AllocatedFundsSummary;
import com.flagship.fundraising_ledger.allocation.dto.AllocationRequest;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.ClubAccess;
import com.flagship.fundraising_ledger.ledger.LedgerMutationResult;
import com.flagship.fundraising_ledger.ledger.dto.LedgerMutationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Allocation checks and transfers of club funds to campaigns and events.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AllocationController {

    private final AllocationGuard allocationGuard;
    private final AllocationService allocationService;
    private final HierarchyResolver hierarchyResolver;

    @GetMapping("/clubs/{clubId}/financials/check-allocation")
    public AllocationCheck checkAllocation(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId,
            @RequestParam("amount") BigDecimal amount) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        hierarchyResolver.resolveScope(clubId, null, null);
        return allocationGuard.checkAllocation(clubId, amount);
    }

    @GetMapping("/clubs/{clubId}/financials/allocated-funds")
    public AllocatedFundsSummary allocatedFunds(
            @PathVariable("clubId") UUID clubId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID callerClubId) {
        ClubAccess.requireSameClub(callerClubId, clubId);
        return allocationService.summarize(clubId);
    }

    @PostMapping("/campaigns/{campaignId}/allocations")
    public ResponseEntity<LedgerMutationResponse> allocateToCampaign(
            @PathVariable("campaignId") UUID campaignId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody AllocationRequest request) {
        return respond(allocationService.allocateToCampaign(
                clubId, campaignId, request.getAmount(), request.getDescription(), idempotencyKey));
    }

    @PostMapping("/events/{eventId}/allocations")
    public ResponseEntity<LedgerMutationResponse> allocateToEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(ClubAccess.CLUB_ID_HEADER) UUID clubId,
            @RequestHeader(value = ClubAccess.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody AllocationRequest request) {
        return respond(allocationService.allocateToEvent(
                clubId, eventId, request.getAmount(), request.getDescription(), idempotencyKey));
    }

    private static ResponseEntity<LedgerMutationResponse> respond(LedgerMutationResult result) {
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(LedgerMutationResponse.from(result));
    }
}
