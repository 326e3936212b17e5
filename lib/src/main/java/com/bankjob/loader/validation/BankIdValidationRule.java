package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import com.bankjob.loader.LoaderMessage.Level;
import java.util.List;

/** OFX {@code BANKID} is optional but at most 9 characters. */
final class BankIdValidationRule implements ValidationRule {

    static final int MAX_LENGTH = 9;

    @Override
    public List<LoaderMessage> validate(Statement statement) {
        String bankId = statement.getBankId();
        if (bankId != null && bankId.length() > MAX_LENGTH) {
            return List.of(
                    new LoaderMessage(
                            Level.ERROR, "Bank id longer than " + MAX_LENGTH + " characters", bankId));
        }
        return List.of();
    }
}
