package com.flagship.fundraising_ledger.ledger;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses entry dates. Accepts an ISO date ("2024-03-15"), a local date-time
 * ("2024-03-15T23:00:00") or an offset date-time ("2024-03-15T23:00:00Z");
 * only the calendar date is kept.
 */
public final class EntryDates {

    private EntryDates() {
    }

    public static Optional<LocalDate> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException ignored) {
            // fall through to date-time forms
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // fall through to offset form
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * @throws IllegalArgumentException if the value is not a recognised date
     */
    public static LocalDate parse(String raw) {
        return tryParse(raw).orElseThrow(
                () -> new IllegalArgumentException("Date must be a valid date: " + raw));
    }
}
