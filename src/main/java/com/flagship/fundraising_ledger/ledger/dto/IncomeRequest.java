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
 * Body of income create and update requests.
 *
 * Nothing is bean-validated here: the ledger validator checks drafts so that
 * every rule failure is reported together. amount may be a JSON number or a
 * numeric string.
 */
@Value
@Builder
@Jacksonized
public class IncomeRequest {

    @JsonProperty("source")
    String source;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    JsonNode amount;

    @JsonProperty("date")
    String date;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("campaign_id")
    UUID campaignId;

    @JsonProperty("event_id")
    UUID eventId;

    public LedgerEntryDraft toDraft(UUID clubId, UUID campaignId, UUID eventId) {
        return LedgerEntryDraft.builder()
                .kind(EntryKind.INCOME)
                .ownerClubId(clubId)
                .campaignId(campaignId)
                .eventId(eventId)
                .label(source)
                .description(description)
                .amount(amount)
                .date(date)
                .paymentMethod(paymentMethod)
                .reference(reference)
                .build();
    }

    public LedgerEntryPatch toPatch() {
        return LedgerEntryPatch.builder()
                .label(source)
                .description(description)
                .amount(amount)
                .date(date)
                .paymentMethod(paymentMethod)
                .reference(reference)
                .campaignId(campaignId)
                .eventId(eventId)
                .build();
    }
}
