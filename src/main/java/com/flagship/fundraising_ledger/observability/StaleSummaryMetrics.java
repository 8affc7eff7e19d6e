package com.flagship.fundraising_ledger.observability;

import com.flagship.fundraising_ledger.hierarchy.CampaignRepository;
import com.flagship.fundraising_ledger.hierarchy.ClubRepository;
import com.flagship.fundraising_ledger.hierarchy.EventRepository;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Number of summaries currently marked STALE, per level. A summary leaves
 * this count once a later recompute of the node succeeds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleSummaryMetrics {

    private final ClubRepository clubRepository;
    private final CampaignRepository campaignRepository;
    private final EventRepository eventRepository;
    private final MeterRegistry meterRegistry;

    private final Map<OwnershipLevel, AtomicLong> staleCounts = new EnumMap<>(OwnershipLevel.class);

    @PostConstruct
    public void init() {
        for (OwnershipLevel level : OwnershipLevel.values()) {
            AtomicLong count = new AtomicLong();
            staleCounts.put(level, count);
            Gauge.builder("rollup.summaries.stale.current", count, AtomicLong::get)
                    .description("Summaries waiting for a successful recompute")
                    .tag("level", level.name().toLowerCase())
                    .register(meterRegistry);
        }
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            staleCounts.get(OwnershipLevel.CLUB).set(clubRepository.countBySummaryStatus(SummaryStatus.STALE));
            staleCounts.get(OwnershipLevel.CAMPAIGN).set(campaignRepository.countBySummaryStatus(SummaryStatus.STALE));
            staleCounts.get(OwnershipLevel.EVENT).set(eventRepository.countBySummaryStatus(SummaryStatus.STALE));
        } catch (Exception e) {
            log.warn("Failed to refresh stale summary metrics: {}", e.getMessage());
        }
    }

    public long getStaleCount(OwnershipLevel level) {
        return staleCounts.get(level).get();
    }
}
