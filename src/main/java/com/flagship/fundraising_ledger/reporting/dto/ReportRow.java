package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of the expenses-by-category or income-by-source report.
 * min and max are only reported for expenses.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportRow {
    @JsonProperty("category")
    String category;

    @JsonProperty("source")
    String source;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("average_amount")
    BigDecimal averageAmount;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;
}
