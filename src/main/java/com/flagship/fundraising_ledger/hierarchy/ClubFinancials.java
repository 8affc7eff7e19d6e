package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived totals of a club across all levels.
 *
 * totalIncome includes allocated funds, since an allocation is recorded as
 * income of the receiving campaign or event. allocatedFunds and
 * availableForAllocation come from the allocation guard.
 */
@Value
public class ClubFinancials {
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal netProfit;
    BigDecimal allocatedFunds;
    BigDecimal availableForAllocation;

    public static ClubFinancials empty() {
        return new ClubFinancials(MoneyUtil.zero(), MoneyUtil.zero(), MoneyUtil.zero(),
                MoneyUtil.zero(), MoneyUtil.zero());
    }
}
