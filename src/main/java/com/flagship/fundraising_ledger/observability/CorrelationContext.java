package com.flagship.fundraising_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread request context for log correlation.
 *
 * The correlation id comes from the X-Correlation-ID header or is generated.
 * Mutations also put the club and entry they touch into the MDC so every
 * log line of a recompute can be traced back to the change that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CLUB_ID_MDC_KEY = "clubId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void putClub(UUID clubId) {
        if (clubId != null) {
            MDC.put(CLUB_ID_MDC_KEY, clubId.toString());
        }
    }

    public static void putEntry(UUID entryId) {
        if (entryId != null) {
            MDC.put(ENTRY_ID_MDC_KEY, entryId.toString());
        }
    }

    /**
     * Removes the thread-local id and every MDC key this class sets.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CLUB_ID_MDC_KEY);
        MDC.remove(ENTRY_ID_MDC_KEY);
    }

    /**
     * Short id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
