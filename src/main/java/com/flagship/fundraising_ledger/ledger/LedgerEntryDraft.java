package com.flagship.fundraising_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Candidate entry as submitted, before validation.
 *
 * Amount and date are kept raw so the validator can report bad input
 * instead of failing during binding.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntryDraft {
    EntryKind kind;
    UUID ownerClubId;
    UUID campaignId;
    UUID eventId;
    String label;
    String description;
    Object amount;
    String date;
    String paymentMethod;
    String status;
    String reference;
    String vendor;
    String receiptUrl;
    String createdBy;

    public OwnershipLevel getLevel() {
        return OwnershipLevel.of(campaignId, eventId);
    }

    /**
     * Builds a draft holding the current values of a stored entry, used as
     * the base for a partial update.
     */
    public static LedgerEntryDraft from(LedgerEntry entry) {
        LedgerEntryDraftBuilder builder = LedgerEntryDraft.builder()
                .kind(entry.getKind())
                .ownerClubId(entry.getOwnerClubId())
                .campaignId(entry.getCampaignId())
                .eventId(entry.getEventId())
                .label(entry.getLabel())
                .description(entry.getDescription())
                .amount(entry.getAmount())
                .date(entry.getDate().toString())
                .paymentMethod(entry.getPaymentMethodCode());
        if (entry instanceof Income) {
            builder.reference(((Income) entry).getReference());
        } else if (entry instanceof Expense) {
            Expense expense = (Expense) entry;
            builder.status(expense.getStatus().getCode())
                    .vendor(expense.getVendor())
                    .receiptUrl(expense.getReceiptUrl())
                    .createdBy(expense.getCreatedBy());
        }
        return builder.build();
    }

    /**
     * Converts a validated draft into an entry. Call only after the
     * validator accepted the draft.
     */
    public LedgerEntry toEntry(UUID id, Instant createdAt, Instant updatedAt) {
        if (kind == EntryKind.INCOME) {
            return Income.builder()
                    .id(id)
                    .ownerClubId(ownerClubId)
                    .campaignId(campaignId)
                    .eventId(eventId)
                    .source(label.trim())
                    .description(description.trim())
                    .amount(MoneyUtil.coerce(amount))
                    .date(EntryDates.parse(date))
                    .paymentMethod(IncomePaymentMethod.parse(paymentMethod).orElse(IncomePaymentMethod.DEFAULT))
                    .reference(reference)
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .build();
        }
        return Expense.builder()
                .id(id)
                .ownerClubId(ownerClubId)
                .campaignId(campaignId)
                .eventId(eventId)
                .category(label.trim())
                .description(description.trim())
                .amount(MoneyUtil.coerce(amount))
                .date(EntryDates.parse(date))
                .vendor(vendor)
                .paymentMethod(ExpensePaymentMethod.parse(paymentMethod).orElse(ExpensePaymentMethod.DEFAULT))
                .status(ExpenseStatus.parse(status).orElse(ExpenseStatus.DEFAULT))
                .receiptUrl(receiptUrl)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
