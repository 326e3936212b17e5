package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import com.bankjob.loader.LoaderMessage.Level;
import java.util.List;
import java.util.regex.Pattern;

final class CurrencyValidationRule implements ValidationRule {

    // ISO 4217 alphabetic code
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("[A-Z]{3}");

    @Override
    public List<LoaderMessage> validate(Statement statement) {
        String currency = statement.getCurrency();
        if (currency == null || !CURRENCY_PATTERN.matcher(currency).matches()) {
            return List.of(
                    new LoaderMessage(Level.ERROR, "Currency must be a three-letter code", currency));
        }
        return List.of();
    }
}
