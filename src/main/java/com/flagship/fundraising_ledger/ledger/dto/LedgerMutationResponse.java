package com.flagship.fundraising_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.allocation.AllocationCheck;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.LedgerMutationResult;
import com.flagship.fundraising_ledger.recalc.RecalculationResult;
import lombok.Value;

/**
 * Response to a create, update or delete. summary_status is STALE when a
 * summary could not be brought up to date; clients can show it as
 * "recalculating".
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerMutationResponse {

    @JsonProperty("entry")
    LedgerEntryResponse entry;

    @JsonProperty("summary_status")
    SummaryStatus summaryStatus;

    @JsonProperty("recalculation")
    RecalculationResult recalculation;

    @JsonProperty("allocation_check")
    AllocationCheck allocationCheck;

    @JsonProperty("allocation_warning")
    String allocationWarning;

    @JsonProperty("replayed")
    boolean replayed;

    public static LedgerMutationResponse from(LedgerMutationResult result) {
        return new LedgerMutationResponse(
                LedgerEntryResponse.from(result.getEntry()),
                result.getSummaryStatus(),
                result.getRecalculation(),
                result.getAllocationCheck(),
                result.getAllocationWarning(),
                result.isReplayed());
    }
}
