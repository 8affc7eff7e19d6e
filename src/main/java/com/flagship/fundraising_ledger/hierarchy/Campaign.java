package com.flagship.fundraising_ledger.hierarchy;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class Campaign {
    UUID id;
    UUID clubId;
    String name;
    BigDecimal targetAmount;
    LocalDate startDate;
    LocalDate endDate;
    CampaignFinancials financials;
    SummaryStatus summaryStatus;
    Instant summaryRefreshedAt;
}
