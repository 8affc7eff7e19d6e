package com.flagship.fundraising_ledger.recalc;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fundraising_ledger.hierarchy.SummaryStatus;
import lombok.Value;

import java.util.List;

/**
 * All node recomputes triggered by one change, bottom-up (event, campaign,
 * club). The overall status is STALE if any node is stale.
 */
@Value
public class RecalculationResult {
    @JsonProperty("nodes")
    List<NodeRecalculation> nodes;

    @JsonProperty("summary_status")
    public SummaryStatus getSummaryStatus() {
        return nodes.stream().anyMatch(NodeRecalculation::isStale) ? SummaryStatus.STALE : SummaryStatus.FRESH;
    }
}
