package com.flagship.fundraising_ledger.exception;

import java.util.List;

/**
 * An entry was given both a campaign and an event, or an update tried to
 * move an entry to another campaign or event.
 */
public class MutualExclusivityException extends LedgerValidationException {

    public MutualExclusivityException(List<String> violations) {
        super(violations);
    }

    public MutualExclusivityException(String violation) {
        super(List.of(violation));
    }
}
