package com.flagship.fundraising_ledger.exception;

/**
 * An amount could not be read as a finite decimal number.
 */
public class InvalidAmountException extends RuntimeException {

    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
