package com.bankjob.upload;

import com.bankjob.ledger.LedgerException;

/** The upload sink could not be reached or refused the request outright. */
public final class UploadException extends LedgerException {

    public UploadException(String message) {
        super(message);
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
