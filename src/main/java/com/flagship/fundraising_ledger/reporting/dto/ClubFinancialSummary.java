package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.export.CurrencyCode;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Club dashboard figures. Totals are computed from the ledger on request;
 * campaign and event performance comes from their stored summaries, whose
 * freshness is given per node.
 */
@Value
@Builder
public class ClubFinancialSummary {
    @JsonProperty("club_id")
    UUID clubId;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("net_profit")
    BigDecimal netProfit;

    @JsonProperty("pending_expenses")
    BigDecimal pendingExpenses;

    @JsonProperty("approved_expenses")
    BigDecimal approvedExpenses;

    @JsonProperty("allocated_funds")
    BigDecimal allocatedFunds;

    @JsonProperty("available_for_allocation")
    BigDecimal availableForAllocation;

    @JsonProperty("club_level_income")
    BigDecimal clubLevelIncome;

    @JsonProperty("club_level_expenses")
    BigDecimal clubLevelExpenses;

    @JsonProperty("profit_margin")
    BigDecimal profitMargin;

    @JsonProperty("expenses_by_category")
    Map<String, BigDecimal> expensesByCategory;

    @JsonProperty("income_by_source")
    Map<String, BigDecimal> incomeBySource;

    @JsonProperty("income_by_payment_method")
    Map<String, BigDecimal> incomeByPaymentMethod;

    @JsonProperty("campaign_performance")
    List<NodeSummary> campaignPerformance;

    @JsonProperty("event_performance")
    List<NodeSummary> eventPerformance;

    @JsonProperty("formatted")
    Map<String, String> formatted;

    @JsonProperty("summary_status")
    SummaryStatus summaryStatus;

    @JsonProperty("partial")
    boolean partial;
}
