package com.bankjob.ledger;

/** A CSV record could not be turned into a transaction. */
public final class RecordFormatException extends LedgerException {
    private final int line;

    public RecordFormatException(String message) {
        this(message, 0);
    }

    public RecordFormatException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    /** One-based line of the offending row, or 0 when unknown. */
    public int getLine() {
        return line;
    }
}
