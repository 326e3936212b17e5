package com.bankjob.ledger;

/**
 * Raised when two statements cannot be merged because the incoming transactions do not extend the
 * existing ones contiguously. The message names both date ranges and the first transaction that
 * broke contiguity so a gap or mismatched overlap can be tracked down by hand.
 */
public final class MergeConflictException extends LedgerException {
    private final String existingRange;
    private final String incomingRange;
    private final transient Transaction offending;

    public MergeConflictException(
            String existingRange, String incomingRange, Transaction offending, String reason) {
        super(
                "Failed to merge statement "
                        + incomingRange
                        + " into "
                        + existingRange
                        + ": "
                        + reason
                        + (offending == null ? "" : " at " + offending));
        this.existingRange = existingRange;
        this.incomingRange = incomingRange;
        this.offending = offending;
    }

    public String getExistingRange() {
        return existingRange;
    }

    public String getIncomingRange() {
        return incomingRange;
    }

    public Transaction getOffending() {
        return offending;
    }
}
