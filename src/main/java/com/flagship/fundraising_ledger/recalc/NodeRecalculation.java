package com.flagship.fundraising_ledger.recalc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of recomputing one node. financials is the stored summary on
 * success and null when the node was marked stale.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeRecalculation {
    @JsonProperty("level")
    OwnershipLevel level;

    @JsonProperty("node_id")
    UUID nodeId;

    @JsonProperty("summary_status")
    SummaryStatus summaryStatus;

    @JsonProperty("financials")
    Object financials;

    @JsonProperty("failure_reason")
    String failureReason;

    public static NodeRecalculation fresh(RecomputeKey key, Object financials) {
        return new NodeRecalculation(key.getLevel(), key.getNodeId(), SummaryStatus.FRESH, financials, null);
    }

    public static NodeRecalculation stale(RecomputeKey key, String reason) {
        return new NodeRecalculation(key.getLevel(), key.getNodeId(), SummaryStatus.STALE, null, reason);
    }

    public boolean isStale() {
        return summaryStatus == SummaryStatus.STALE;
    }
}
