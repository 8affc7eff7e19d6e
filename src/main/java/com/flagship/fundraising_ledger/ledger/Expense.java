package com.flagship.fundraising_ledger.ledger;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Money spent by a club, campaign or event.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Expense extends LedgerEntry {

    private final String category;
    private final String vendor;
    private final ExpensePaymentMethod paymentMethod;
    private final ExpenseStatus status;
    private final String receiptUrl;
    private final String createdBy;

    @Builder
    public Expense(UUID id, UUID ownerClubId, UUID campaignId, UUID eventId,
                   String category, String description, BigDecimal amount, LocalDate date,
                   String vendor, ExpensePaymentMethod paymentMethod, ExpenseStatus status,
                   String receiptUrl, String createdBy,
                   Instant createdAt, Instant updatedAt) {
        super(id, ownerClubId, campaignId, eventId, description, amount, date, createdAt, updatedAt);
        this.category = category;
        this.vendor = vendor;
        this.paymentMethod = paymentMethod != null ? paymentMethod : ExpensePaymentMethod.DEFAULT;
        this.status = status != null ? status : ExpenseStatus.DEFAULT;
        this.receiptUrl = receiptUrl;
        this.createdBy = createdBy;
    }

    @Override
    public EntryKind getKind() {
        return EntryKind.EXPENSE;
    }

    @Override
    public String getLabel() {
        return category;
    }

    @Override
    public String getPaymentMethodCode() {
        return paymentMethod.getCode();
    }
}
