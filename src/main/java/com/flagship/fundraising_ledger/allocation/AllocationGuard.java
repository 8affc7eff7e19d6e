package com.flagship.fundraising_ledger.allocation;

import com.flagship.fundraising_ledger.hierarchy.ClubWideEntries;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.EntryKind;
import com.flagship.fundraising_ledger.ledger.Income;
import com.flagship.fundraising_ledger.ledger.IncomePaymentMethod;
import com.flagship.fundraising_ledger.ledger.LedgerEntryDraft;
import com.flagship.fundraising_ledger.ledger.MoneyUtil;
import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.UUID;

/**
 * Keeps a club from allocating more than it holds.
 *
 * An allocation is income with payment method allocated_funds recorded on a
 * campaign or event of the club. The guard never throws for an overrun; it
 * reports it, and the caller decides based on the enforcement mode.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationGuard {

    public static final String ALLOCATED_FUNDS_SOURCE = "Allocated Funds";

    private final HierarchyResolver hierarchyResolver;
    private final FinancialMetrics metrics;

    /**
     * Sum of allocations the club has made to its campaigns and events.
     */
    public BigDecimal allocatedSoFar(UUID clubId, Collection<Income> clubWideIncome) {
        return MoneyUtil.sum(clubWideIncome.stream()
                .filter(income -> clubId.equals(income.getOwnerClubId()))
                .filter(Income::isAllocation)
                .map(Income::getAmount)
                .toList());
    }

    public AllocationPosition position(UUID clubId, Collection<Income> clubWideIncome, boolean partial) {
        BigDecimal total = MoneyUtil.sum(clubWideIncome.stream().map(Income::getAmount).toList());
        BigDecimal held = MoneyUtil.sum(clubWideIncome.stream()
                .filter(income -> !income.isAllocation())
                .map(Income::getAmount)
                .toList());
        BigDecimal allocated = allocatedSoFar(clubId, clubWideIncome);
        BigDecimal available = held.subtract(allocated).max(BigDecimal.ZERO);
        return new AllocationPosition(total, held, allocated, MoneyUtil.format(available), partial);
    }

    public AllocationCheck checkAllocation(UUID clubId, BigDecimal requestedAmount) {
        BigDecimal requested = MoneyUtil.format(requestedAmount);
        if (!MoneyUtil.isPositive(requested)) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
        ClubWideEntries income = hierarchyResolver.collectClubWideEntries(clubId, EntryKind.INCOME);
        AllocationPosition position = position(clubId, income.entriesOf(Income.class), income.isPartial());
        AllocationCheck check = evaluate(position, requested);

        metrics.recordAllocationCheck(check.isCanAllocate());
        if (!check.isCanAllocate()) {
            log.info("Allocation of {} for club {} exceeds available {}",
                    requested, clubId, position.getAvailableForAllocation());
        }
        return check;
    }

    public AllocationCheck evaluate(AllocationPosition position, BigDecimal requested) {
        boolean canAllocate = requested.compareTo(position.getAvailableForAllocation()) <= 0;
        String warning = null;
        if (!canAllocate) {
            warning = "Insufficient funds. Available: " + position.getAvailableForAllocation().toPlainString()
                    + ", Requested: " + requested.toPlainString();
        }
        if (position.isPartial()) {
            String note = "Club ledger could only be read partially; available funds may be misstated";
            warning = warning == null ? note : warning + ". " + note;
        }
        return new AllocationCheck(position.getHeldIncome(), position.getTotalAllocated(),
                position.getAvailableForAllocation(), requested, canAllocate, warning);
    }

    /**
     * Income draft moving {@code amount} from the club to a campaign or event.
     * Goes through the normal create path; building it does not re-check.
     */
    public LedgerEntryDraft allocationDraft(UUID clubId, OwnershipLevel targetLevel, UUID targetId,
                                            BigDecimal amount, String description, LocalDate today) {
        if (targetLevel == OwnershipLevel.CLUB) {
            throw new IllegalArgumentException("Funds can only be allocated to a campaign or event");
        }
        return LedgerEntryDraft.builder()
                .kind(EntryKind.INCOME)
                .ownerClubId(clubId)
                .campaignId(targetLevel == OwnershipLevel.CAMPAIGN ? targetId : null)
                .eventId(targetLevel == OwnershipLevel.EVENT ? targetId : null)
                .label(ALLOCATED_FUNDS_SOURCE)
                .description(description)
                .amount(amount)
                .date(today.toString())
                .paymentMethod(IncomePaymentMethod.ALLOCATED_FUNDS.getCode())
                .build();
    }
}
