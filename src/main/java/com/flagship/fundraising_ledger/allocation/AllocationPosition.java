package com.flagship.fundraising_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A club's allocation balance at one point in time.
 *
 * heldIncome is every club-wide income entry that is not itself an
 * allocation; totalAllocated is what has already been moved down to
 * campaigns and events. availableForAllocation is their difference,
 * floored at zero.
 */
@Value
public class AllocationPosition {
    BigDecimal totalIncome;
    BigDecimal heldIncome;
    BigDecimal totalAllocated;
    BigDecimal availableForAllocation;
    boolean partial;
}
