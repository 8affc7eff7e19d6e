package com.flagship.fundraising_ledger.ledger;

/**
 * The two kinds of ledger record a club keeps.
 *
 * Each kind knows its table, the name of its free-form label column
 * (source for income, category for expenses) and the noun used in
 * messages and event types.
 */
public enum EntryKind {
    INCOME("income", "source", "Income", "Source"),
    EXPENSE("expenses", "category", "Expense", "Category");

    private final String table;
    private final String labelColumn;
    private final String displayName;
    private final String labelName;

    EntryKind(String table, String labelColumn, String displayName, String labelName) {
        this.table = table;
        this.labelColumn = labelColumn;
        this.displayName = displayName;
        this.labelName = labelName;
    }

    public String getTable() {
        return table;
    }

    public String getLabelColumn() {
        return labelColumn;
    }

    /**
     * "Income" or "Expense"; used as the prefix of outbox event types.
     */
    public String getDisplayName() {
        return displayName;
    }

    public String getLabelName() {
        return labelName;
    }
}
