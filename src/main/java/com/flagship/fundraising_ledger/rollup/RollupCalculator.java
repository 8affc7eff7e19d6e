package com.flagship.fundraising_ledger.rollup;

import com.flagship.fundraising_ledger.hierarchy.CampaignFinancials;
import com.flagship.fundraising_ledger.hierarchy.EventFinancials;
import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Pure arithmetic over entry lists: totals, profit, progress, breakdowns
 * and filters. Holds no state and never modifies its input.
 */
@Component
public class RollupCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public BigDecimal totalOf(Collection<? extends LedgerEntry> entries) {
        return MoneyUtil.sum(entries.stream().map(LedgerEntry::getAmount).toList());
    }

    public BigDecimal netProfit(BigDecimal income, BigDecimal expenses) {
        return MoneyUtil.format(income.subtract(expenses));
    }

    /**
     * actual / target * 100, capped at 100 and never below 0. Zero when the
     * target is missing or not positive.
     */
    public BigDecimal progressPercentage(BigDecimal actual, BigDecimal target) {
        BigDecimal percentage = achievementPercentage(actual, target);
        if (percentage.compareTo(HUNDRED) > 0) {
            return MoneyUtil.format(HUNDRED);
        }
        if (percentage.signum() < 0) {
            return MoneyUtil.zero();
        }
        return percentage;
    }

    /**
     * Uncapped actual / target * 100; zero when the target is not positive.
     */
    public BigDecimal achievementPercentage(BigDecimal actual, BigDecimal target) {
        return MoneyUtil.percentage(actual, target);
    }

    /**
     * (income - expenses) / income * 100; zero when there is no income.
     */
    public BigDecimal profitMargin(BigDecimal income, BigDecimal expenses) {
        return MoneyUtil.percentage(netProfit(income, expenses), income);
    }

    public FinancialStatus financialStatus(BigDecimal actual, BigDecimal goal) {
        return FinancialStatus.forAchievement(achievementPercentage(actual, goal));
    }

    /**
     * Sums amounts per key, keys in order of first appearance.
     */
    public <T extends LedgerEntry, K> Map<K, BigDecimal> breakdownBy(Collection<T> entries,
                                                                   Function<? super T, K> keyFn) {
        Map<K, BigDecimal> totals = new LinkedHashMap<>();
        for (T entry : entries) {
            totals.merge(keyFn.apply(entry), entry.getAmount(), BigDecimal::add);
        }
        totals.replaceAll((key, amount) -> MoneyUtil.format(amount));
        return totals;
    }

    /**
     * Entries attached to the given level. A null level keeps everything.
     */
    public <T extends LedgerEntry> List<T> filterByLevel(Collection<T> entries, OwnershipLevel level) {
        if (level == null) {
            return List.copyOf(entries);
        }
        return entries.stream().filter(e -> e.getLevel() == level).toList();
    }

    public <T extends LedgerEntry> List<T> filterByDateRange(Collection<T> entries, DateRange range) {
        if (range == null || range.isUnbounded()) {
            return List.copyOf(entries);
        }
        return entries.stream().filter(e -> range.contains(e.getDate())).toList();
    }

    public <T extends LedgerEntry> List<T> filter(Collection<T> entries, EntryFilter filter) {
        Predicate<T> predicate = e -> true;
        if (filter.getLevel() != null) {
            predicate = predicate.and(e -> e.getLevel() == filter.getLevel());
        }
        if (filter.getCampaignId() != null) {
            predicate = predicate.and(e -> filter.getCampaignId().equals(e.getCampaignId()));
        }
        if (filter.getEventId() != null) {
            predicate = predicate.and(e -> filter.getEventId().equals(e.getEventId()));
        }
        if (filter.getLabel() != null) {
            predicate = predicate.and(e -> filter.getLabel().equalsIgnoreCase(e.getLabel()));
        }
        if (filter.getPaymentMethod() != null) {
            String method = filter.getPaymentMethod().replace('-', '_');
            predicate = predicate.and(e -> method.equalsIgnoreCase(e.getPaymentMethodCode()));
        }
        if (filter.getStatus() != null) {
            predicate = predicate.and(e -> e instanceof Expense
                    && filter.getStatus().equalsIgnoreCase(((Expense) e).getStatus().getCode()));
        }
        DateRange range = filter.getDateRange();
        if (!range.isUnbounded()) {
            predicate = predicate.and(e -> range.contains(e.getDate()));
        }
        return entries.stream().filter(predicate).toList();
    }

    public EventFinancials eventFinancials(Collection<? extends LedgerEntry> income,
                                           Collection<? extends LedgerEntry> expenses) {
        BigDecimal actual = totalOf(income);
        BigDecimal spent = totalOf(expenses);
        return new EventFinancials(actual, spent, netProfit(actual, spent));
    }

    public CampaignFinancials campaignFinancials(Collection<? extends LedgerEntry> income,
                                                 Collection<? extends LedgerEntry> expenses,
                                                 BigDecimal targetAmount) {
        BigDecimal raised = totalOf(income);
        BigDecimal spent = totalOf(expenses);
        return new CampaignFinancials(raised, spent, netProfit(raised, spent),
                progressPercentage(raised, Objects.requireNonNullElse(targetAmount, BigDecimal.ZERO)));
    }
}
