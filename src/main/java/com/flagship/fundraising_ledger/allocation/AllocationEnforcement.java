package com.flagship.fundraising_ledger.allocation;

/**
 * How an allocation beyond the available balance is handled.
 *
 * ADVISORY stores the allocation and returns the check's warning with it.
 * STRICT rejects it before anything is written.
 */
public enum AllocationEnforcement {
    ADVISORY,
    STRICT
}
