package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class EventBreakdown {
    @JsonProperty("summary")
    NodeSummary summary;

    @JsonProperty("income_breakdown")
    List<GroupTotal> incomeBreakdown;

    @JsonProperty("expense_breakdown")
    List<GroupTotal> expenseBreakdown;
}
