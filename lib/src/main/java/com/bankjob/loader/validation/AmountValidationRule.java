package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import com.bankjob.loader.LoaderMessage;
import com.bankjob.loader.LoaderMessage.Level;
import com.bankjob.support.AmountParser;
import java.util.ArrayList;
import java.util.List;

/**
 * Rejects amounts, balances and closing balances that would otherwise be exported as zero. The
 * closing balances are read with the separator of the first transaction.
 */
final class AmountValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(Statement statement) {
        List<LoaderMessage> messages = new ArrayList<>();
        List<Transaction> transactions = statement.getTransactions();
        for (Transaction transaction : transactions) {
            char separator = transaction.getDecimalSeparator();
            check("amount", transaction.getAmount(), separator, transaction.getId(), messages);
            check("new balance", transaction.getNewBalance(), separator, transaction.getId(), messages);
        }
        char separator =
                transactions.isEmpty() ? AmountParser.PERIOD : transactions.get(0).getDecimalSeparator();
        if (statement.getClosingBalance() != null) {
            check("closing balance", statement.getClosingBalance(), separator, "", messages);
        }
        if (statement.getClosingAvailable() != null) {
            check("closing available balance", statement.getClosingAvailable(), separator, "", messages);
        }
        return messages;
    }

    private static void check(
            String what, String text, char separator, String subject, List<LoaderMessage> out) {
        try {
            AmountParser.parseStrict(text, separator);
        } catch (NumberFormatException ex) {
            out.add(new LoaderMessage(Level.ERROR, "Unparsable " + what + ": \"" + text + "\"", subject));
        }
    }
}
