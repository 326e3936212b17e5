package com.bankjob.ledger;

/**
 * Checked exception signalling that a ledger operation (reading records, merging statements,
 * validating a statement) could not be completed. Subclasses name the failure kind.
 */
public class LedgerException extends Exception {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
