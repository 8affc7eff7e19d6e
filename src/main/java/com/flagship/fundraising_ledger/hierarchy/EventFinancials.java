package com.flagship.fundraising_ledger.hierarchy;

import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived totals of one event.
 */
@Value
public class EventFinancials {
    BigDecimal actualAmount;
    BigDecimal totalExpenses;
    BigDecimal netProfit;

    public static EventFinancials empty() {
        return new EventFinancials(MoneyUtil.zero(), MoneyUtil.zero(), MoneyUtil.zero());
    }
}
