package com.flagship.fundraising_ledger.rollup;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Goal achievement band of an event or campaign.
 */
public enum FinancialStatus {
    EXCELLENT("excellent", new BigDecimal("100")),
    GOOD("good", new BigDecimal("75")),
    ON_TRACK("on-track", new BigDecimal("50")),
    BEHIND("behind", new BigDecimal("25")),
    POOR("poor", BigDecimal.ZERO);

    private final String code;
    private final BigDecimal threshold;

    FinancialStatus(String code, BigDecimal threshold) {
        this.code = code;
        this.threshold = threshold;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Band for an uncapped achievement percentage.
     */
    public static FinancialStatus forAchievement(BigDecimal percentage) {
        for (FinancialStatus status : values()) {
            if (percentage.compareTo(status.threshold) >= 0) {
                return status;
            }
        }
        return POOR;
    }
}
