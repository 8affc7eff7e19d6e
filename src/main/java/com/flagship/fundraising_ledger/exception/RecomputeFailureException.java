package com.flagship.fundraising_ledger.exception;

/**
 * A summary recompute could not produce a complete result. Raised inside
 * the recalculation retry loop; after the last attempt the node is marked
 * stale instead of propagating this to the caller.
 */
public class RecomputeFailureException extends RuntimeException {

    public RecomputeFailureException(String message) {
        super(message);
    }

    public RecomputeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
