package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class MonthlyTrend {
    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("net_profit")
    BigDecimal netProfit;
}
