package com.flagship.fundraising_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.LedgerEntryPatch;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Body of expense create and update requests. See {@link IncomeRequest}.
 */
@Value
@Builder
@Jacksonized
public class ExpenseRequest {

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    JsonNode amount;

    @JsonProperty("date")
    String date;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("status")
    String status;

    @JsonProperty("receipt_url")
    String receiptUrl;

    @JsonProperty("campaign_id")
    UUID campaignId;

    @JsonProperty("event_id")
    UUID eventId;

    public LedgerEntryDraft toDraft(UUID clubId, UUID campaignId, UUID eventId, String createdBy) {
        return LedgerEntryDraft.builder()
                .kind(EntryKind.EXPENSE)
                .ownerClubId(clubId)
                .campaignId(campaignId)
                .eventId(eventId)
                .label(category)
                .description(description)
                .amount(amount)
                .date(date)
                .vendor(vendor)
                .paymentMethod(paymentMethod)
                .status(status)
                .receiptUrl(receiptUrl)
                .createdBy(createdBy)
                .build();
    }

    public LedgerEntryPatch toPatch() {
        return LedgerEntryPatch.builder()
                .label(category)
                .description(description)
                .amount(amount)
                .date(date)
                .vendor(vendor)
                .paymentMethod(paymentMethod)
                .status(status)
                .receiptUrl(receiptUrl)
                .campaignId(campaignId)
                .eventId(eventId)
                .build();
    }
}
