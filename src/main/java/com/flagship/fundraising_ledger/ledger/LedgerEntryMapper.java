package com.flagship.fundraising_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts between stored rows and domain entries.
 *
 * Reading a row coerces its amount; a row whose amount is not numeric
 * raises {@link com.flagship.fundraising_ledger.exception.InvalidAmountException}.
 * Unknown payment methods or statuses in old rows map to OTHER / PENDING.
 */
@Component
@Slf4j
public class LedgerEntryMapper {

    public LedgerEntry toEntry(StoredEntry row) {
        if (row.getKind() == EntryKind.INCOME) {
            return Income.builder()
                    .id(row.getId())
                    .ownerClubId(row.getClubId())
                    .campaignId(row.getCampaignId())
                    .eventId(row.getEventId())
                    .source(row.getLabel())
                    .description(row.getDescription())
                    .amount(MoneyUtil.coerce(row.getAmount()))
                    .date(row.getDate())
                    .paymentMethod(IncomePaymentMethod.parse(row.getPaymentMethod())
                            .orElseGet(() -> unknownMethod(row, IncomePaymentMethod.OTHER)))
                    .reference(row.getReference())
                    .createdAt(row.getCreatedAt())
                    .updatedAt(row.getUpdatedAt())
                    .build();
        }
        return Expense.builder()
                .id(row.getId())
                .ownerClubId(row.getClubId())
                .campaignId(row.getCampaignId())
                .eventId(row.getEventId())
                .category(row.getLabel())
                .description(row.getDescription())
                .amount(MoneyUtil.coerce(row.getAmount()))
                .date(row.getDate())
                .vendor(row.getVendor())
                .paymentMethod(ExpensePaymentMethod.parse(row.getPaymentMethod())
                        .orElseGet(() -> unknownMethod(row, ExpensePaymentMethod.OTHER)))
                .status(ExpenseStatus.parse(row.getStatus()).orElse(ExpenseStatus.PENDING))
                .receiptUrl(row.getReceiptUrl())
                .createdBy(row.getCreatedBy())
                .createdAt(row.getCreatedAt())
                .updatedAt(row.getUpdatedAt())
                .build();
    }

    public StoredEntry toStored(LedgerEntry entry, String idempotencyKey) {
        StoredEntry.StoredEntryBuilder builder = StoredEntry.builder()
                .id(entry.getId())
                .kind(entry.getKind())
                .clubId(entry.getOwnerClubId())
                .campaignId(entry.getCampaignId())
                .eventId(entry.getEventId())
                .label(entry.getLabel())
                .description(entry.getDescription())
                .amount(entry.getAmount().toPlainString())
                .date(entry.getDate())
                .paymentMethod(entry.getPaymentMethodCode())
                .idempotencyKey(idempotencyKey)
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt());
        if (entry instanceof Income) {
            builder.reference(((Income) entry).getReference());
        } else if (entry instanceof Expense) {
            Expense expense = (Expense) entry;
            builder.status(expense.getStatus().getCode())
                    .vendor(expense.getVendor())
                    .receiptUrl(expense.getReceiptUrl())
                    .createdBy(expense.getCreatedBy());
        }
        return builder.build();
    }

    private <T> T unknownMethod(StoredEntry row, T fallback) {
        log.debug("Unknown payment method '{}' on {} {}, reading as {}",
                row.getPaymentMethod(), row.getKind(), row.getId(), fallback);
        return fallback;
    }
}
