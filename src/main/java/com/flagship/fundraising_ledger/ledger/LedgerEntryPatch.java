package com.flagship.fundraising_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Partial update of an entry. Null fields are left unchanged.
 *
 * campaignId and eventId are carried only so an attempt to move an entry
 * can be detected and rejected; the level of an entry never changes.
 */
@Value
@Builder
public class LedgerEntryPatch {
    String label;
    String description;
    Object amount;
    String date;
    String paymentMethod;
    String status;
    String reference;
    String vendor;
    String receiptUrl;
    UUID campaignId;
    UUID eventId;

    /**
     * True when no updatable field is present. Income ignores the
     * expense-only fields and vice versa.
     */
    public boolean isEmptyFor(EntryKind kind) {
        boolean common = label == null && description == null && amount == null
                && date == null && paymentMethod == null;
        if (kind == EntryKind.INCOME) {
            return common && reference == null;
        }
        return common && status == null && vendor == null && receiptUrl == null;
    }

    /**
     * True if the patch names a campaign or event different from the
     * entry's current one.
     */
    public boolean reassigns(LedgerEntry existing) {
        boolean campaignChange = campaignId != null && !campaignId.equals(existing.getCampaignId());
        boolean eventChange = eventId != null && !eventId.equals(existing.getEventId());
        return campaignChange || eventChange;
    }

    public LedgerEntryDraft applyTo(LedgerEntryDraft base) {
        LedgerEntryDraft.LedgerEntryDraftBuilder builder = base.toBuilder();
        if (label != null) builder.label(label);
        if (description != null) builder.description(description);
        if (amount != null) builder.amount(amount);
        if (date != null) builder.date(date);
        if (paymentMethod != null) builder.paymentMethod(paymentMethod);
        if (base.getKind() == EntryKind.INCOME) {
            if (reference != null) builder.reference(reference);
        } else {
            if (status != null) builder.status(status);
            if (vendor != null) builder.vendor(vendor);
            if (receiptUrl != null) builder.receiptUrl(receiptUrl);
        }
        return builder.build();
    }
}
