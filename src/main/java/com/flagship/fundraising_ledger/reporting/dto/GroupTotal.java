package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Total and count of entries sharing the same grouping keys. Keys that are
 * not part of the grouping are left out.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroupTotal {
    @JsonProperty("source")
    String source;

    @JsonProperty("category")
    String category;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("status")
    String status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("count")
    long count;
}
