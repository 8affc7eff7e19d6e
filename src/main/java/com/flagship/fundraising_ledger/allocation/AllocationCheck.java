package com.flagship.fundraising_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Answer to "can the club allocate this amount?".
 *
 * totalIncome here is the income the club holds, excluding allocations it
 * has already made. warning is set whenever canAllocate is false, and also
 * when the club ledger could only be read partially.
 */
@Value
public class AllocationCheck {
    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_allocated")
    BigDecimal totalAllocated;

    @JsonProperty("available_for_allocation")
    BigDecimal availableForAllocation;

    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @JsonProperty("can_allocate")
    boolean canAllocate;

    @JsonProperty("warning")
    String warning;
}
