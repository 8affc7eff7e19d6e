package com.flagship.fundraising_ledger.exception;

import com.flagship.fundraising_ledger.allocation.AllocationCheck;

/**
 * Thrown in strict enforcement mode when an allocation asks for more than
 * the club has available.
 */
public class AllocationOverrunException extends RuntimeException {

    private final transient AllocationCheck check;

    public AllocationOverrunException(AllocationCheck check) {
        super(check.getWarning());
        this.check = check;
    }

    public AllocationCheck getCheck() {
        return check;
    }
}
