package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.rollup.FinancialStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Financial picture of one event or campaign against its goal or target.
 *
 * achievement_percentage is uncapped; progress_percentage is capped at 100.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeSummary {
    @JsonProperty("id")
    UUID id;

    @JsonProperty("level")
    OwnershipLevel level;

    @JsonProperty("name")
    String name;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("goal_amount")
    BigDecimal goalAmount;

    @JsonProperty("actual_amount")
    BigDecimal actualAmount;

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("net_profit")
    BigDecimal netProfit;

    @JsonProperty("allocated_funds")
    BigDecimal allocatedFunds;

    @JsonProperty("achievement_percentage")
    BigDecimal achievementPercentage;

    @JsonProperty("progress_percentage")
    BigDecimal progressPercentage;

    @JsonProperty("financial_status")
    FinancialStatus financialStatus;

    @JsonProperty("summary_status")
    SummaryStatus summaryStatus;
}
