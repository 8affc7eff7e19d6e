package com.flagship.fundraising_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the cached gauge values. Both refreshes query the database, so
 * they run here on a fixed rate instead of on every scrape.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final StaleSummaryMetrics staleSummaryMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        staleSummaryMetrics.refreshMetrics();
    }
}
