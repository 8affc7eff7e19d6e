package com.flagship.fundraising_ledger.ledger;

import java.util.Locale;
import java.util.UUID;

/**
 * The level of the fundraising hierarchy an entry belongs to.
 *
 * Derived from which foreign key is set; it is never stored.
 */
public enum OwnershipLevel {
    CLUB,
    CAMPAIGN,
    EVENT;

    /**
     * Classifies by foreign keys: EVENT if an event is set, CAMPAIGN if a
     * campaign is set, CLUB otherwise.
     */
    public static OwnershipLevel of(UUID campaignId, UUID eventId) {
        if (eventId != null) {
            return EVENT;
        }
        if (campaignId != null) {
            return CAMPAIGN;
        }
        return CLUB;
    }

    /**
     * Parses a level query parameter. "all" and blank mean no level filter
     * and return null.
     *
     * @throws IllegalArgumentException for any other unknown value
     */
    public static OwnershipLevel fromParam(String value) {
        if (value == null || value.isBlank() || "all".equalsIgnoreCase(value.trim())) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid level: " + value + " (expected all, club, campaign or event)");
        }
    }
}
