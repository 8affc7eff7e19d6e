package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived totals of one campaign: its own entries plus those of every
 * event in it. progressPercentage is capped at 100.
 */
@Value
public class CampaignFinancials {
    BigDecimal totalRaised;
    BigDecimal totalExpenses;
    BigDecimal totalProfit;
    BigDecimal progressPercentage;

    public static CampaignFinancials empty() {
        return new CampaignFinancials(MoneyUtil.zero(), MoneyUtil.zero(), MoneyUtil.zero(), MoneyUtil.zero());
    }
}
