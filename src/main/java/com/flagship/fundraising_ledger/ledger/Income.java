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
 * Money received by a club, campaign or event.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Income extends LedgerEntry {

    private final String source;
    private final IncomePaymentMethod paymentMethod;
    private final String reference;

    @Builder
    public Income(UUID id, UUID ownerClubId, UUID campaignId, UUID eventId,
                  String source, String description, BigDecimal amount, LocalDate date,
                  IncomePaymentMethod paymentMethod, String reference,
                  Instant createdAt, Instant updatedAt) {
        super(id, ownerClubId, campaignId, eventId, description, amount, date, createdAt, updatedAt);
        this.source = source;
        this.paymentMethod = paymentMethod != null ? paymentMethod : IncomePaymentMethod.DEFAULT;
        this.reference = reference;
    }

    @Override
    public EntryKind getKind() {
        return EntryKind.INCOME;
    }

    @Override
    public String getLabel() {
        return source;
    }

    @Override
    public String getPaymentMethodCode() {
        return paymentMethod.getCode();
    }

    /**
     * True for money the club moved down to one of its campaigns or events.
     * Club-level entries are never allocations, whatever their method.
     */
    public boolean isAllocation() {
        return paymentMethod == IncomePaymentMethod.ALLOCATED_FUNDS
                && getLevel() != OwnershipLevel.CLUB;
    }
}
