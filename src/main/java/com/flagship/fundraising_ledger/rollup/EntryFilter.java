package com.flagship.fundraising_ledger.rollup;

import com.flagship.fundraising_ledger.ledger.EntryDates;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Optional filter dimensions for entry lists. A null field does not filter.
 * Label, payment method and status compare case-insensitively; status only
 * applies to expenses.
 */
@Value
@Builder
public class EntryFilter {
    OwnershipLevel level;
    UUID campaignId;
    UUID eventId;
    String label;
    String paymentMethod;
    String status;
    LocalDate from;
    LocalDate to;

    public static EntryFilter none() {
        return EntryFilter.builder().build();
    }

    public DateRange getDateRange() {
        return DateRange.of(from, to);
    }

    /**
     * Builds a filter from request parameters, validating each one.
     *
     * @throws IllegalArgumentException for an unknown level or unparseable date
     */
    public static EntryFilter fromParams(String level, UUID campaignId, UUID eventId, String label,
                                         String paymentMethod, String status,
                                         String startDate, String endDate) {
        return EntryFilter.builder()
                .level(OwnershipLevel.fromParam(level))
                .campaignId(campaignId)
                .eventId(eventId)
                .label(blankToNull(label))
                .paymentMethod(blankToNull(paymentMethod))
                .status(blankToNull(status))
                .from(parseDate(startDate, "start_date"))
                .to(parseDate(endDate, "end_date"))
                .build();
    }

    private static LocalDate parseDate(String raw, String name) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return EntryDates.tryParse(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid " + name + ": " + raw));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
