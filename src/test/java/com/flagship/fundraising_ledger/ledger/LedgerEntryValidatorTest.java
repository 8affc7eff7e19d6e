package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.exception.LedgerValidationException;
import com.flagship.fundraising_ledger.exception.MutualExclusivityException;
import com.flagship.fundraising_ledger.support.Drafts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LedgerEntryValidatorTest {

    private final LedgerEntryValidator validator = new LedgerEntryValidator();
    private final UUID clubId = UUID.randomUUID();

    @Test
    @DisplayName("A complete draft passes")
    void validDraftPasses() {
        ValidationResult result = validator.validate(Drafts.income(clubId, null, null, "25.00"));

        assertTrue(result.isOk());
        assertDoesNotThrow(result::throwIfInvalid);
    }

    @Test
    @DisplayName("Every violation is reported at once, in rule order")
    void collectsAllViolationsInOrder() {
        LedgerEntryDraft draft = LedgerEntryDraft.builder()
                .kind(EntryKind.EXPENSE)
                .ownerClubId(clubId)
                .campaignId(UUID.randomUUID())
                .eventId(UUID.randomUUID())
                .label(" ")
                .amount("0")
                .date("15/03/2024")
                .paymentMethod("bitcoin")
                .status("rejected")
                .build();

        ValidationResult result = validator.validate(draft);

        List<ViolationCode> codes = result.getViolations().stream().map(Violation::getCode).toList();
        assertEquals(List.of(
                ViolationCode.REQUIRED,
                ViolationCode.REQUIRED,
                ViolationCode.NON_POSITIVE_AMOUNT,
                ViolationCode.INVALID_DATE,
                ViolationCode.MUTUAL_EXCLUSIVITY,
                ViolationCode.INVALID_PAYMENT_METHOD,
                ViolationCode.INVALID_STATUS), codes);
        assertEquals("Category is required", result.getMessages().get(0));
        assertEquals("Expense cannot be assigned to both event and campaign", result.getMessages().get(4));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-5", "abc", "", "NaN"})
    @DisplayName("Amounts that are not strictly positive numbers are rejected")
    void rejectsBadAmounts(String amount) {
        ValidationResult result = validator.validate(Drafts.income(clubId, null, null, amount));

        assertFalse(result.isOk());
        assertEquals(ViolationCode.NON_POSITIVE_AMOUNT, result.getViolations().get(0).getCode());
        assertEquals("Amount must be greater than 0", result.getMessages().get(0));
    }

    @Test
    @DisplayName("Missing amount and missing date are both reported")
    void missingAmountAndDate() {
        LedgerEntryDraft draft = Drafts.income(clubId, null, null, null).toBuilder().date(null).build();

        ValidationResult result = validator.validate(draft);

        assertEquals(List.of("Amount must be greater than 0", "Date is required"), result.getMessages());
    }

    @Test
    @DisplayName("Naming both a campaign and an event raises a mutual exclusivity error")
    void campaignAndEventIsMutualExclusivity() {
        LedgerEntryDraft draft = Drafts.income(clubId, UUID.randomUUID(), UUID.randomUUID(), "10");

        ValidationResult result = validator.validate(draft);

        assertTrue(result.hasMutualExclusivityViolation());
        MutualExclusivityException e = assertThrows(MutualExclusivityException.class, result::throwIfInvalid);
        assertEquals(List.of("Income cannot be assigned to both event and campaign"), e.getViolations());
    }

    @Test
    @DisplayName("Other violations raise a plain validation error")
    void otherViolationsRaiseValidationException() {
        ValidationResult result = validator.validate(Drafts.expense(clubId, null, null, "-1"));

        LedgerValidationException e = assertThrows(LedgerValidationException.class, result::throwIfInvalid);
        assertFalse(e instanceof MutualExclusivityException);
    }

    @Test
    @DisplayName("Allocated funds cannot be recorded at club level")
    void allocatedFundsNeedsCampaignOrEvent() {
        LedgerEntryDraft atClub = Drafts.income(clubId, null, null, "100").toBuilder()
                .paymentMethod("allocated-funds")
                .build();
        LedgerEntryDraft atCampaign = atClub.toBuilder().campaignId(UUID.randomUUID()).build();

        assertEquals(List.of("Allocated funds must be assigned to a campaign or event"),
                validator.validate(atClub).getMessages());
        assertTrue(validator.validate(atCampaign).isOk());
    }

    @Test
    @DisplayName("Expense-only methods and statuses are checked against the expense lists")
    void expensePaymentMethodsAndStatuses() {
        LedgerEntryDraft donation = Drafts.expense(clubId, null, null, "10").toBuilder()
                .paymentMethod("donation")
                .build();
        LedgerEntryDraft paid = Drafts.expense(clubId, null, null, "10").toBuilder()
                .paymentMethod("TRANSFER")
                .status("Paid")
                .build();

        assertEquals(ViolationCode.INVALID_PAYMENT_METHOD, validator.validate(donation).getViolations().get(0).getCode());
        assertTrue(validator.validate(paid).isOk());
    }

    @Test
    @DisplayName("Date-time input is accepted and truncated to the calendar date")
    void acceptsDateTimes() {
        LedgerEntryDraft draft = Drafts.income(clubId, null, null, "10").toBuilder()
                .date("2024-03-15T23:00:00Z")
                .build();

        assertTrue(validator.validate(draft).isOk());
        assertEquals("2024-03-15", draft.toEntry(UUID.randomUUID(), null, null).getDate().toString());
    }
}
