package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A campaign's own entries, its events, and the totals of both combined.
 */
@Value
@Builder
public class CampaignBreakdown {
    @JsonProperty("summary")
    NodeSummary summary;

    @JsonProperty("campaign_income")
    List<LedgerEntryResponse> campaignIncome;

    @JsonProperty("campaign_expenses")
    List<LedgerEntryResponse> campaignExpenses;

    @JsonProperty("events")
    List<NodeSummary> events;

    @JsonProperty("event_income_total")
    BigDecimal eventIncomeTotal;

    @JsonProperty("event_expenses_total")
    BigDecimal eventExpensesTotal;
}
