package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import com.bankjob.loader.LoaderMessage.Level;
import java.util.List;

/** OFX {@code ACCTID} is 1 to 22 characters. */
final class AccountNumberValidationRule implements ValidationRule {

    static final int MAX_LENGTH = 22;

    @Override
    public List<LoaderMessage> validate(Statement statement) {
        String accountNumber = statement.getAccountNumber();
        if (accountNumber == null || accountNumber.isEmpty()) {
            return List.of(new LoaderMessage(Level.ERROR, "Account number is missing", ""));
        }
        if (accountNumber.length() > MAX_LENGTH) {
            return List.of(
                    new LoaderMessage(
                            Level.ERROR,
                            "Account number longer than " + MAX_LENGTH + " characters",
                            accountNumber));
        }
        return List.of();
    }
}
