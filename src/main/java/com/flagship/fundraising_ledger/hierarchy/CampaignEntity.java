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
@Table(name = "campaigns")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CampaignEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "club_id", nullable = false, updatable = false)
    private UUID clubId;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(name = "target_amount", nullable = false, precision = 14, scale = 2, updatable = false)
    private BigDecimal targetAmount;

    @Column(name = "start_date", updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", updatable = false)
    private LocalDate endDate;

    @Column(name = "total_raised", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalRaised;

    @Column(name = "total_expenses", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalExpenses;

    @Column(name = "total_profit", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalProfit;

    @Column(name = "progress_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal progressPercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "summary_status", nullable = false, length = 10)
    private SummaryStatus summaryStatus;

    @Column(name = "summary_refreshed_at")
    private Instant summaryRefreshedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    void applyFinancials(CampaignFinancials financials) {
        this.totalRaised = financials.getTotalRaised();
        this.totalExpenses = financials.getTotalExpenses();
        this.totalProfit = financials.getTotalProfit();
        this.progressPercentage = financials.getProgressPercentage();
        this.summaryStatus = SummaryStatus.FRESH;
        this.summaryRefreshedAt = Instant.now();
    }

    void markStale() {
        this.summaryStatus = SummaryStatus.STALE;
    }

    Campaign toDomain() {
        return new Campaign(id, clubId, name, targetAmount, startDate, endDate,
                new CampaignFinancials(totalRaised, totalExpenses, totalProfit, progressPercentage),
                summaryStatus, summaryRefreshedAt);
    }
}
