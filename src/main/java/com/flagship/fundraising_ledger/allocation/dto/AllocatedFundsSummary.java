package com.flagship.fundraising_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Where a club's allocated funds went, per campaign and per event.
 */
@Value
@Builder
public class AllocatedFundsSummary {

    @JsonProperty("club_id")
    UUID clubId;

    @JsonProperty("total_allocated")
    BigDecimal totalAllocated;

    @JsonProperty("available_for_allocation")
    BigDecimal availableForAllocation;

    @JsonProperty("campaign_allocations")
    List<NodeAllocation> campaignAllocations;

    @JsonProperty("event_allocations")
    List<NodeAllocation> eventAllocations;

    @JsonProperty("partial")
    boolean partial;

    @Value
    public static class NodeAllocation {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("name")
        String name;

        @JsonProperty("allocated_amount")
        BigDecimal allocatedAmount;

        @JsonProperty("allocation_count")
        int allocationCount;
    }
}
