package com.bankjob.scraper;

import com.bankjob.ledger.LedgerException;

/** Fetching or extracting a statement from a bank failed. */
public final class ScrapeException extends LedgerException {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
