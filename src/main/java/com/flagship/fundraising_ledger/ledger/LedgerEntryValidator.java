package com.flagship.fundraising_ledger.ledger;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a draft entry before anything is written.
 *
 * All rules are evaluated and every violation is returned together, in a
 * fixed order: label and description, amount, date, campaign/event
 * exclusivity, then payment method and status. The validator has no side
 * effects.
 */
@Component
public class LedgerEntryValidator {

    public ValidationResult validate(LedgerEntryDraft draft) {
        List<Violation> violations = new ArrayList<>();
        EntryKind kind = draft.getKind() != null ? draft.getKind() : EntryKind.INCOME;

        if (isBlank(draft.getLabel())) {
            violations.add(new Violation(kind.getLabelColumn(), ViolationCode.REQUIRED,
                    kind.getLabelName() + " is required"));
        }
        if (isBlank(draft.getDescription())) {
            violations.add(new Violation("description", ViolationCode.REQUIRED,
                    "Description is required"));
        }

        boolean positive = MoneyUtil.tryCoerce(draft.getAmount())
                .map(MoneyUtil::isPositive)
                .orElse(false);
        if (!positive) {
            violations.add(new Violation("amount", ViolationCode.NON_POSITIVE_AMOUNT,
                    "Amount must be greater than 0"));
        }

        if (isBlank(draft.getDate())) {
            violations.add(new Violation("date", ViolationCode.REQUIRED, "Date is required"));
        } else if (EntryDates.tryParse(draft.getDate()).isEmpty()) {
            violations.add(new Violation("date", ViolationCode.INVALID_DATE,
                    "Date must be a valid date"));
        }

        if (draft.getCampaignId() != null && draft.getEventId() != null) {
            violations.add(new Violation("event_id", ViolationCode.MUTUAL_EXCLUSIVITY,
                    kind.getDisplayName() + " cannot be assigned to both event and campaign"));
        }

        validatePaymentMethod(kind, draft, violations);

        if (kind == EntryKind.EXPENSE && !isBlank(draft.getStatus())
                && ExpenseStatus.parse(draft.getStatus()).isEmpty()) {
            violations.add(new Violation("status", ViolationCode.INVALID_STATUS,
                    "Status must be one of pending, approved, paid"));
        }

        return violations.isEmpty() ? ValidationResult.ok() : ValidationResult.of(violations);
    }

    private void validatePaymentMethod(EntryKind kind, LedgerEntryDraft draft, List<Violation> violations) {
        String method = draft.getPaymentMethod();
        if (isBlank(method)) {
            return;
        }
        if (kind == EntryKind.EXPENSE) {
            if (ExpensePaymentMethod.parse(method).isEmpty()) {
                violations.add(new Violation("payment_method", ViolationCode.INVALID_PAYMENT_METHOD,
                        "Payment method '" + method + "' is not valid for expenses"));
            }
            return;
        }
        Optional<IncomePaymentMethod> parsed = IncomePaymentMethod.parse(method);
        if (parsed.isEmpty()) {
            violations.add(new Violation("payment_method", ViolationCode.INVALID_PAYMENT_METHOD,
                    "Payment method '" + method + "' is not valid for income"));
        } else if (parsed.get() == IncomePaymentMethod.ALLOCATED_FUNDS
                && draft.getLevel() == OwnershipLevel.CLUB) {
            violations.add(new Violation("payment_method", ViolationCode.INVALID_PAYMENT_METHOD,
                    "Allocated funds must be assigned to a campaign or event"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
