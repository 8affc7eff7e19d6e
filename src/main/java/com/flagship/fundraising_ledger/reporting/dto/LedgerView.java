package com.flagship.fundraising_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Filtered club-wide list of income or expenses with its totals.
 * approved_total and pending_total are only set for expenses.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerView {
    @JsonProperty("kind")
    EntryKind kind;

    @JsonProperty("entries")
    List<LedgerEntryResponse> entries;

    @JsonProperty("count")
    int count;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("breakdown")
    Map<String, BigDecimal> breakdown;

    @JsonProperty("approved_total")
    BigDecimal approvedTotal;

    @JsonProperty("pending_total")
    BigDecimal pendingTotal;

    @JsonProperty("partial")
    boolean partial;

    @JsonProperty("failed_scopes")
    List<ClubWideEntries.FailedScope> failedScopes;
}
