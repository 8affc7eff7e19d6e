package com.flagship.fundraising_ledger.hierarchy;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Club {
    UUID id;
    String name;
    ClubFinancials financials;
    SummaryStatus summaryStatus;
    Instant summaryRefreshedAt;
}
