package com.bankjob.loader.validation;

import com.bankjob.ledger.LedgerException;
import com.bankjob.loader.LoaderMessage;
import java.util.List;

/** A statement failed validation and cannot be exported. */
public final class ValidationException extends LedgerException {

    private final List<LoaderMessage> messages;

    public ValidationException(String message, List<LoaderMessage> messages) {
        super(message);
        this.messages = List.copyOf(messages);
    }

    /** Every diagnostic of the failed run, warnings included. */
    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
