package com.flagship.fundraising_ledger.reporting;

import com.flagship.fundraising_ledger.allocation.AllocationGuard;
import com.flagship.fundraising_ledger.allocation.AllocationPosition;
import com.flagship.fundraising_ledger.export.CurrencyCode;
import com.flagship.fundraising_ledger.export.CurrencyFormatter;
import com.flagship.fundraising_ledger.hierarchy.Campaign;
import com.flagship.fundraising_ledger.hierarchy.CampaignFinancials;
import com.flagship.fundraising_ledger.hierarchy.Club;
import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.hierarchy.EventFinancials;
import com.flagship.fundraising_ledger.hierarchy.FundraisingEvent;
import com.flagship.fundraising_ledger.hierarchy.FundraisingHierarchyStore;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Expense;
import com.flagship.fundraising_ledger.ledger.ExpenseStatus;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.LedgerEntry;
import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fundraising_ledger.reporting.dto.CampaignBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.ClubFinancialSummary;
import com.flagship.fundraising_ledger.reporting.dto.EventBreakdown;
import com.flagship.fundraising_ledger.reporting.dto.GroupTotal;
import com.flagship.fundraising_ledger.reporting.dto.LedgerView;
import com.flagship.fundraising_ledger.reporting.dto.MonthlyTrend;
import com.flagship.fundraising_ledger.reporting.dto.NodeSummary;
import com.flagship.fundraising_ledger.reporting.dto.ReportRow;
import com.flagship.fundraising_ledger.rollup.EntryFilter;
import com.flagship.fundraising_ledger.rollup.RollupCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Read-only financial views of a club: dashboard summary, per-node
 * breakdowns, reports and the filtered ledger.
 *
 * Club-wide figures are computed from the ledger on every request and carry
 * the partial flag of the underlying collection. Nothing here writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialReportingService {

    private final HierarchyResolver hierarchyResolver;
    private final FundraisingHierarchyStore hierarchyStore;
    private final RollupCalculator calculator;
    private final AllocationGuard allocationGuard;
    private final CurrencyFormatter currencyFormatter;

    public ClubFinancialSummary clubSummary(UUID clubId, CurrencyCode currency) {
        Club club = requireClub(clubId);
        List<Campaign> campaigns = hierarchyStore.listCampaigns(clubId);
        List<FundraisingEvent> events = hierarchyStore.listEvents(clubId);
        ClubWideEntries income = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.INCOME, campaigns, events);
        ClubWideEntries expenses = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.EXPENSE, campaigns, events);
        boolean partial = income.isPartial() || expenses.isPartial();

        List<Income> incomes = income.entriesOf(Income.class);
        List<Expense> expenseList = expenses.entriesOf(Expense.class);
        BigDecimal totalIncome = calculator.totalOf(incomes);
        BigDecimal totalExpenses = calculator.totalOf(expenseList);
        BigDecimal netProfit = calculator.netProfit(totalIncome, totalExpenses);
        BigDecimal pending = calculator.totalOf(expenseList.stream()
                .filter(e -> e.getStatus() == ExpenseStatus.PENDING).toList());
        AllocationPosition position = allocationGuard.position(clubId, incomes, partial);

        Map<String, String> formatted = new LinkedHashMap<>();
        formatted.put("total_income", currencyFormatter.format(totalIncome, currency));
        formatted.put("total_expenses", currencyFormatter.format(totalExpenses, currency));
        formatted.put("net_profit", currencyFormatter.format(netProfit, currency));
        formatted.put("allocated_funds", currencyFormatter.format(position.getTotalAllocated(), currency));
        formatted.put("available_for_allocation",
                currencyFormatter.format(position.getAvailableForAllocation(), currency));

        if (partial) {
            log.warn("Financial summary of club {} is based on a partial ledger", clubId);
        }

        return ClubFinancialSummary.builder()
                .clubId(clubId)
                .currency(currency)
                .totalIncome(totalIncome)
                .totalExpenses(totalExpenses)
                .netProfit(netProfit)
                .pendingExpenses(pending)
                .approvedExpenses(MoneyUtil.format(totalExpenses.subtract(pending)))
                .allocatedFunds(position.getTotalAllocated())
                .availableForAllocation(position.getAvailableForAllocation())
                .clubLevelIncome(calculator.totalOf(calculator.filterByLevel(incomes, OwnershipLevel.CLUB)))
                .clubLevelExpenses(calculator.totalOf(calculator.filterByLevel(expenseList, OwnershipLevel.CLUB)))
                .profitMargin(calculator.profitMargin(totalIncome, totalExpenses))
                .expensesByCategory(sortedByTotal(calculator.breakdownBy(expenseList, Expense::getCategory)))
                .incomeBySource(sortedByTotal(calculator.breakdownBy(incomes, Income::getSource)))
                .incomeByPaymentMethod(sortedByTotal(calculator.breakdownBy(incomes, Income::getPaymentMethodCode)))
                .campaignPerformance(campaigns.stream().map(c -> storedCampaignSummary(c, incomes)).toList())
                .eventPerformance(events.stream().map(e -> storedEventSummary(e, incomes)).toList())
                .formatted(formatted)
                .summaryStatus(club.getSummaryStatus())
                .partial(partial)
                .build();
    }

    /**
     * Live breakdown of one event from its own entries.
     */
    public EventBreakdown eventBreakdown(UUID clubId, UUID eventId) {
        FundraisingEvent event = hierarchyResolver.requireEvent(clubId, eventId);
        List<Income> income = entriesOf(
                hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.EVENT, eventId), Income.class);
        List<Expense> expenses = entriesOf(
                hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.EVENT, eventId), Expense.class);

        List<GroupTotal> incomeBreakdown = groupTotals(income,
                i -> List.of(i.getSource(), i.getPaymentMethodCode()),
                (key, amount, count) -> GroupTotal.builder()
                        .source(key.get(0)).paymentMethod(key.get(1)).amount(amount).count(count).build());
        List<GroupTotal> expenseBreakdown = groupTotals(expenses,
                e -> List.of(e.getCategory(), e.getPaymentMethodCode(), e.getStatus().getCode()),
                (key, amount, count) -> GroupTotal.builder()
                        .category(key.get(0)).paymentMethod(key.get(1)).status(key.get(2))
                        .amount(amount).count(count).build());

        return new EventBreakdown(liveEventSummary(event, income, expenses), incomeBreakdown, expenseBreakdown);
    }

    public CampaignBreakdown campaignBreakdown(UUID clubId, UUID campaignId) {
        Campaign campaign = hierarchyResolver.requireCampaign(clubId, campaignId);
        List<Income> campaignIncome = entriesOf(
                hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.CAMPAIGN, campaignId), Income.class);
        List<Expense> campaignExpenses = entriesOf(
                hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.CAMPAIGN, campaignId), Expense.class);

        List<Income> eventIncome = new ArrayList<>();
        List<Expense> eventExpenses = new ArrayList<>();
        List<NodeSummary> eventSummaries = new ArrayList<>();
        for (FundraisingEvent event : hierarchyStore.listEventsForCampaign(campaignId)) {
            List<Income> income = entriesOf(
                    hierarchyResolver.fetchLevel(EntryKind.INCOME, OwnershipLevel.EVENT, event.getId()), Income.class);
            List<Expense> expenses = entriesOf(
                    hierarchyResolver.fetchLevel(EntryKind.EXPENSE, OwnershipLevel.EVENT, event.getId()), Expense.class);
            eventIncome.addAll(income);
            eventExpenses.addAll(expenses);
            eventSummaries.add(liveEventSummary(event, income, expenses));
        }

        List<Income> allIncome = new ArrayList<>(campaignIncome);
        allIncome.addAll(eventIncome);
        List<Expense> allExpenses = new ArrayList<>(campaignExpenses);
        allExpenses.addAll(eventExpenses);
        BigDecimal raised = calculator.totalOf(allIncome);
        BigDecimal spent = calculator.totalOf(allExpenses);
        BigDecimal target = campaign.getTargetAmount() != null ? campaign.getTargetAmount() : BigDecimal.ZERO;

        NodeSummary summary = NodeSummary.builder()
                .id(campaign.getId())
                .level(OwnershipLevel.CAMPAIGN)
                .name(campaign.getName())
                .date(campaign.getStartDate())
                .goalAmount(MoneyUtil.format(target))
                .actualAmount(raised)
                .totalExpenses(spent)
                .netProfit(calculator.netProfit(raised, spent))
                .allocatedFunds(allocatedIn(allIncome))
                .achievementPercentage(calculator.achievementPercentage(raised, target))
                .progressPercentage(calculator.progressPercentage(raised, target))
                .financialStatus(calculator.financialStatus(raised, target))
                .summaryStatus(campaign.getSummaryStatus())
                .build();

        return CampaignBreakdown.builder()
                .summary(summary)
                .campaignIncome(campaignIncome.stream().map(LedgerEntryResponse::from).toList())
                .campaignExpenses(campaignExpenses.stream().map(LedgerEntryResponse::from).toList())
                .events(eventSummaries)
                .eventIncomeTotal(calculator.totalOf(eventIncome))
                .eventExpensesTotal(calculator.totalOf(eventExpenses))
                .build();
    }

    /**
     * Expenses grouped by category: count, total, average, min and max,
     * largest total first.
     */
    public List<ReportRow> expensesByCategory(UUID clubId, EntryFilter filter) {
        List<Expense> expenses = calculator.filter(
                collect(clubId, EntryKind.EXPENSE).entriesOf(Expense.class), filter);
        Map<String, List<Expense>> groups = new LinkedHashMap<>();
        expenses.forEach(e -> groups.computeIfAbsent(e.getCategory(), k -> new ArrayList<>()).add(e));

        return groups.entrySet().stream()
                .map(group -> {
                    List<BigDecimal> amounts = group.getValue().stream().map(Expense::getAmount).toList();
                    BigDecimal total = MoneyUtil.sum(amounts);
                    return ReportRow.builder()
                            .category(group.getKey())
                            .transactionCount(amounts.size())
                            .totalAmount(total)
                            .averageAmount(average(total, amounts.size()))
                            .minAmount(amounts.stream().min(Comparator.naturalOrder()).orElse(MoneyUtil.zero()))
                            .maxAmount(amounts.stream().max(Comparator.naturalOrder()).orElse(MoneyUtil.zero()))
                            .build();
                })
                .sorted(Comparator.comparing(ReportRow::getTotalAmount).reversed())
                .toList();
    }

    /**
     * Income grouped by source and payment method, largest total first.
     */
    public List<ReportRow> incomeBySource(UUID clubId, EntryFilter filter) {
        List<Income> income = calculator.filter(
                collect(clubId, EntryKind.INCOME).entriesOf(Income.class), filter);
        Map<List<String>, List<Income>> groups = new LinkedHashMap<>();
        income.forEach(i -> groups.computeIfAbsent(
                List.of(i.getSource(), i.getPaymentMethodCode()), k -> new ArrayList<>()).add(i));

        return groups.entrySet().stream()
                .map(group -> {
                    BigDecimal total = calculator.totalOf(group.getValue());
                    return ReportRow.builder()
                            .source(group.getKey().get(0))
                            .paymentMethod(group.getKey().get(1))
                            .transactionCount(group.getValue().size())
                            .totalAmount(total)
                            .averageAmount(average(total, group.getValue().size()))
                            .build();
                })
                .sorted(Comparator.comparing(ReportRow::getTotalAmount).reversed())
                .toList();
    }

    /**
     * Income, expenses and net for each of the twelve months of a year.
     * Months without entries report zeros.
     */
    public List<MonthlyTrend> monthlyTrends(UUID clubId, int year) {
        List<LedgerEntry> income = collect(clubId, EntryKind.INCOME).getEntries();
        List<LedgerEntry> expenses = collect(clubId, EntryKind.EXPENSE).getEntries();

        List<MonthlyTrend> months = new ArrayList<>(12);
        for (int month = 1; month <= 12; month++) {
            Predicate<LedgerEntry> inMonth = inMonth(year, month);
            BigDecimal monthIncome = calculator.totalOf(income.stream().filter(inMonth).toList());
            BigDecimal monthExpenses = calculator.totalOf(expenses.stream().filter(inMonth).toList());
            months.add(new MonthlyTrend(month, year, monthIncome, monthExpenses,
                    calculator.netProfit(monthIncome, monthExpenses)));
        }
        return months;
    }

    /**
     * Expenses still awaiting approval, most recently created first.
     */
    public List<LedgerEntryResponse> pendingExpenses(UUID clubId) {
        return collect(clubId, EntryKind.EXPENSE).entriesOf(Expense.class).stream()
                .filter(e -> e.getStatus() == ExpenseStatus.PENDING)
                .sorted(Comparator.comparing(Expense::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(LedgerEntryResponse::from)
                .toList();
    }

    public LedgerView ledgerView(UUID clubId, EntryKind kind, EntryFilter filter) {
        ClubWideEntries collected = collect(clubId, kind);
        List<LedgerEntry> entries = calculator.filter(collected.getEntries(), filter);

        LedgerView.LedgerViewBuilder view = LedgerView.builder()
                .kind(kind)
                .entries(entries.stream().map(LedgerEntryResponse::from).toList())
                .count(entries.size())
                .total(calculator.totalOf(entries))
                .breakdown(sortedByTotal(calculator.breakdownBy(entries, LedgerEntry::getLabel)))
                .partial(collected.isPartial())
                .failedScopes(collected.getFailedScopes().isEmpty() ? null : collected.getFailedScopes());
        if (kind == EntryKind.EXPENSE) {
            List<Expense> expenses = entriesOf(entries, Expense.class);
            view.approvedTotal(calculator.totalOf(expenses.stream().filter(e -> e.getStatus().isApproved()).toList()))
                    .pendingTotal(calculator.totalOf(expenses.stream().filter(e -> !e.getStatus().isApproved()).toList()));
        }
        return view.build();
    }

    /**
     * Club-wide entries of one kind after filtering, for export.
     */
    public <T extends LedgerEntry> List<T> filteredEntries(UUID clubId, EntryKind kind, EntryFilter filter,
                                                           Class<T> type) {
        ClubWideEntries collected = collect(clubId, kind);
        if (collected.isPartial()) {
            log.warn("Exporting {} of club {} from a partial ledger", kind, clubId);
        }
        return calculator.filter(collected.entriesOf(type), filter);
    }

    private ClubWideEntries collect(UUID clubId, EntryKind kind) {
        requireClub(clubId);
        return hierarchyResolver.collectClubWideEntries(clubId, kind);
    }

    private Club requireClub(UUID clubId) {
        hierarchyResolver.resolveScope(clubId, null, null);
        return hierarchyStore.findClub(clubId).orElseThrow();
    }

    private NodeSummary storedCampaignSummary(Campaign campaign, List<Income> clubIncome) {
        CampaignFinancials stored = campaign.getFinancials() != null ? campaign.getFinancials() : CampaignFinancials.empty();
        BigDecimal target = campaign.getTargetAmount() != null ? campaign.getTargetAmount() : BigDecimal.ZERO;
        return NodeSummary.builder()
                .id(campaign.getId())
                .level(OwnershipLevel.CAMPAIGN)
                .name(campaign.getName())
                .date(campaign.getStartDate())
                .goalAmount(MoneyUtil.format(target))
                .actualAmount(stored.getTotalRaised())
                .totalExpenses(stored.getTotalExpenses())
                .netProfit(stored.getTotalProfit())
                .allocatedFunds(allocatedIn(clubIncome.stream()
                        .filter(i -> campaign.getId().equals(i.getCampaignId())).toList()))
                .achievementPercentage(calculator.achievementPercentage(stored.getTotalRaised(), target))
                .progressPercentage(stored.getProgressPercentage())
                .financialStatus(calculator.financialStatus(stored.getTotalRaised(), target))
                .summaryStatus(campaign.getSummaryStatus())
                .build();
    }

    private NodeSummary storedEventSummary(FundraisingEvent event, List<Income> clubIncome) {
        EventFinancials stored = event.getFinancials() != null ? event.getFinancials() : EventFinancials.empty();
        BigDecimal goal = event.getGoalAmount() != null ? event.getGoalAmount() : BigDecimal.ZERO;
        return NodeSummary.builder()
                .id(event.getId())
                .level(OwnershipLevel.EVENT)
                .name(event.getTitle())
                .date(event.getEventDate())
                .goalAmount(MoneyUtil.format(goal))
                .actualAmount(stored.getActualAmount())
                .totalExpenses(stored.getTotalExpenses())
                .netProfit(stored.getNetProfit())
                .allocatedFunds(allocatedIn(clubIncome.stream()
                        .filter(i -> event.getId().equals(i.getEventId())).toList()))
                .achievementPercentage(calculator.achievementPercentage(stored.getActualAmount(), goal))
                .progressPercentage(calculator.progressPercentage(stored.getActualAmount(), goal))
                .financialStatus(calculator.financialStatus(stored.getActualAmount(), goal))
                .summaryStatus(event.getSummaryStatus())
                .build();
    }

    private NodeSummary liveEventSummary(FundraisingEvent event, List<Income> income, List<Expense> expenses) {
        EventFinancials live = calculator.eventFinancials(income, expenses);
        BigDecimal goal = event.getGoalAmount() != null ? event.getGoalAmount() : BigDecimal.ZERO;
        return NodeSummary.builder()
                .id(event.getId())
                .level(OwnershipLevel.EVENT)
                .name(event.getTitle())
                .date(event.getEventDate())
                .goalAmount(MoneyUtil.format(goal))
                .actualAmount(live.getActualAmount())
                .totalExpenses(live.getTotalExpenses())
                .netProfit(live.getNetProfit())
                .allocatedFunds(allocatedIn(income))
                .achievementPercentage(calculator.achievementPercentage(live.getActualAmount(), goal))
                .progressPercentage(calculator.progressPercentage(live.getActualAmount(), goal))
                .financialStatus(calculator.financialStatus(live.getActualAmount(), goal))
                .summaryStatus(event.getSummaryStatus())
                .build();
    }

    private static BigDecimal allocatedIn(List<Income> income) {
        return MoneyUtil.sum(income.stream().filter(Income::isAllocation).map(Income::getAmount).toList());
    }

    private static BigDecimal average(BigDecimal total, int count) {
        if (count == 0) {
            return MoneyUtil.zero();
        }
        return total.divide(BigDecimal.valueOf(count), MoneyUtil.SCALE, MoneyUtil.ROUNDING);
    }

    private static Predicate<LedgerEntry> inMonth(int year, int month) {
        return entry -> entry.getDate().getYear() == year && entry.getDate().getMonthValue() == month;
    }

    private static <T extends LedgerEntry> List<T> entriesOf(List<LedgerEntry> entries, Class<T> type) {
        return entries.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private static Map<String, BigDecimal> sortedByTotal(Map<String, BigDecimal> totals) {
        Map<String, BigDecimal> sorted = new LinkedHashMap<>();
        totals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private <T extends LedgerEntry> List<GroupTotal> groupTotals(List<T> entries, Function<T, List<String>> keyFn,
                                                                GroupFactory factory) {
        Map<List<String>, List<T>> groups = new LinkedHashMap<>();
        entries.forEach(e -> groups.computeIfAbsent(keyFn.apply(e), k -> new ArrayList<>()).add(e));
        return groups.entrySet().stream()
                .map(g -> factory.create(g.getKey(), calculator.totalOf(g.getValue()), g.getValue().size()))
                .sorted(Comparator.comparing(GroupTotal::getAmount).reversed())
                .toList();
    }

    @FunctionalInterface
    private interface GroupFactory {
        GroupTotal create(List<String> key, BigDecimal amount, long count);
    }
}
