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
import java.util.UUID;

/**
 * JPA mapping of the clubs table.
 *
 * Clubs are created and named elsewhere; this service only rewrites the
 * derived financial columns, through {@link #applyFinancials} and
 * {@link #markStale()}.
 */
@Entity
@Table(name = "clubs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClubEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(name = "total_income", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalIncome;

    @Column(name = "total_expenses", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalExpenses;

    @Column(name = "net_profit", nullable = false, precision = 14, scale = 2)
    private BigDecimal netProfit;

    @Column(name = "allocated_funds", nullable = false, precision = 14, scale = 2)
    private BigDecimal allocatedFunds;

    @Column(name = "available_for_allocation", nullable = false, precision = 14, scale = 2)
    private BigDecimal availableForAllocation;

    @Enumerated(EnumType.STRING)
    @Column(name = "summary_status", nullable = false, length = 10)
    private SummaryStatus summaryStatus;

    @Column(name = "summary_refreshed_at")
    private Instant summaryRefreshedAt;

    void applyFinancials(ClubFinancials financials) {
        this.totalIncome = financials.getTotalIncome();
        this.totalExpenses = financials.getTotalExpenses();
        this.netProfit = financials.getNetProfit();
        this.allocatedFunds = financials.getAllocatedFunds();
        this.availableForAllocation = financials.getAvailableForAllocation();
        this.summaryStatus = SummaryStatus.FRESH;
        this.summaryRefreshedAt = Instant.now();
    }

    void markStale() {
        this.summaryStatus = SummaryStatus.STALE;
    }

    Club toDomain() {
        return new Club(id, name,
                new ClubFinancials(totalIncome, totalExpenses, netProfit, allocatedFunds, availableForAllocation),
                summaryStatus, summaryRefreshedAt);
    }
}
