package com.flagship.fundraising_ledger.hierarchy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "club_id", nullable = false, updatable = false)
    private UUID clubId;

    @Column(name = "campaign_id", updatable = false)
    private UUID campaignId;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(name = "goal_amount", nullable = false, precision = 14, scale = 2, updatable = false)
    private BigDecimal goalAmount;

    @Column(name = "event_date", updatable = false)
    private LocalDate eventDate;

    @Column(name = "actual_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal actualAmount;

    @Column(name = "total_expenses", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalExpenses;

    @Column(name = "net_profit", nullable = false, precision = 14, scale = 2)
    private BigDecimal netProfit;

    @Enumerated(EnumType.STRING)
    @Column(name = "summary_status", nullable = false, length = 10)
    private SummaryStatus summaryStatus;

    @Column(name = "summary_refreshed_at")
    private Instant summaryRefreshedAt;

    void applyFinancials(EventFinancials financials) {
        this.actualAmount = financials.getActualAmount();
        this.totalExpenses = financials.getTotalExpenses();
        this.netProfit = financials.getNetProfit();
        this.summaryStatus = SummaryStatus.FRESH;
        this.summaryRefreshedAt = Instant.now();
    }

    void markStale() {
        this.summaryStatus = SummaryStatus.STALE;
    }

    FundraisingEvent toDomain() {
        return new FundraisingEvent(id, clubId, campaignId, title, goalAmount, eventDate,
                new EventFinancials(actualAmount, totalExpenses, netProfit),
                summaryStatus, summaryRefreshedAt);
    }
}
