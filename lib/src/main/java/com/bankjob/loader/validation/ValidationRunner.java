package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes a list of validation rules and aggregates their diagnostics. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Checks the account details required by OFX. Amounts stay lenient: text that does not parse
     * is exported as zero.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(
                        new AccountNumberValidationRule(),
                        new BankIdValidationRule(),
                        new CurrencyValidationRule(),
                        new TransactionDateValidationRule()));
    }

    /** The default rules plus a check that every amount and balance parses. */
    public static ValidationRunner strictRules() {
        List<ValidationRule> strict = new ArrayList<>(defaultRules().rules);
        strict.add(new AmountValidationRule());
        return new ValidationRunner(strict);
    }

    /**
     * Run all configured rules against the provided statement.
     *
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<LoaderMessage> run(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        List<LoaderMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(statement));
        }
        return diagnostics;
    }
}
