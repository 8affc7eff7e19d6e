package com.flagship.fundraising_ledger.ledger;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A single income or expense record owned by a club.
 *
 * The entry belongs to exactly one level of the hierarchy: the club itself,
 * one of its campaigns, or one of its events. At most one of campaignId and
 * eventId is set, and that assignment never changes after creation.
 *
 * Amounts are fixed-point with scale 2. Instances are immutable.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class LedgerEntry {

    private final UUID id;
    private final UUID ownerClubId;
    private final UUID campaignId;
    private final UUID eventId;
    private final String description;
    private final BigDecimal amount;
    private final LocalDate date;
    private final Instant createdAt;
    private final Instant updatedAt;

    protected LedgerEntry(UUID id, UUID ownerClubId, UUID campaignId, UUID eventId,
                          String description, BigDecimal amount, LocalDate date,
                          Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerClubId = Objects.requireNonNull(ownerClubId, "ownerClubId");
        if (campaignId != null && eventId != null) {
            throw new IllegalArgumentException(
                    "Entry " + id + " cannot belong to both campaign and event");
        }
        this.campaignId = campaignId;
        this.eventId = eventId;
        this.description = description;
        this.amount = MoneyUtil.format(Objects.requireNonNull(amount, "amount"));
        this.date = Objects.requireNonNull(date, "date");
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public abstract EntryKind getKind();

    /**
     * Source for income, category for expenses.
     */
    public abstract String getLabel();

    public abstract String getPaymentMethodCode();

    public OwnershipLevel getLevel() {
        return OwnershipLevel.of(campaignId, eventId);
    }

    /**
     * Id of the campaign or event this entry belongs to, or the club id for
     * club-level entries.
     */
    public UUID getNodeId() {
        return switch (getLevel()) {
            case EVENT -> eventId;
            case CAMPAIGN -> campaignId;
            case CLUB -> ownerClubId;
        };
    }
}
