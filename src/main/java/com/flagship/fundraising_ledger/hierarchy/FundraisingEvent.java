package com.flagship.fundraising_ledger.hierarchy;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A fundraising event of a club, optionally part of a campaign.
 */
@Value
public class FundraisingEvent {
    UUID id;
    UUID clubId;
    UUID campaignId;
    String title;
    BigDecimal goalAmount;
    LocalDate eventDate;
    EventFinancials financials;
    SummaryStatus summaryStatus;
    Instant summaryRefreshedAt;

    public boolean belongsToCampaign() {
        return campaignId != null;
    }
}
