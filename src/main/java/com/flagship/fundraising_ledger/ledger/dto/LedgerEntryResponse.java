package com.flagship.fundraising_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Income or expense as returned by the API. Income-only and expense-only
 * fields are omitted for the other kind.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    EntryKind kind;

    @JsonProperty("club_id")
    UUID clubId;

    @JsonProperty("campaign_id")
    UUID campaignId;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("level")
    OwnershipLevel level;

    @JsonProperty("source")
    String source;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("status")
    String status;

    @JsonProperty("receipt_url")
    String receiptUrl;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        LedgerEntryResponseBuilder builder = LedgerEntryResponse.builder()
                .id(entry.getId())
                .kind(entry.getKind())
                .clubId(entry.getOwnerClubId())
                .campaignId(entry.getCampaignId())
                .eventId(entry.getEventId())
                .level(entry.getLevel())
                .description(entry.getDescription())
                .amount(entry.getAmount())
                .date(entry.getDate())
                .paymentMethod(entry.getPaymentMethodCode())
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt());
        if (entry instanceof Income) {
            Income income = (Income) entry;
            builder.source(income.getSource()).reference(income.getReference());
        } else if (entry instanceof Expense) {
            Expense expense = (Expense) entry;
            builder.category(expense.getCategory())
                    .vendor(expense.getVendor())
                    .status(expense.getStatus().getCode())
                    .receiptUrl(expense.getReceiptUrl())
                    .createdBy(expense.getCreatedBy());
        }
        return builder.build();
    }
}
