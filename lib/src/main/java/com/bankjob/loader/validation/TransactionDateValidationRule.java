package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import com.bankjob.loader.LoaderMessage;
import com.bankjob.loader.LoaderMessage.Level;
import java.util.ArrayList;
import java.util.List;

/** Undated transactions export with an empty {@code DTPOSTED}; worth a warning. */
final class TransactionDateValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(Statement statement) {
        List<LoaderMessage> messages = new ArrayList<>();
        for (Transaction transaction : statement.getTransactions()) {
            if (transaction.getDate() == null) {
                messages.add(
                        new LoaderMessage(
                                Level.WARNING, "Transaction has no posting date", transaction.getId()));
            }
        }
        return messages;
    }
}
