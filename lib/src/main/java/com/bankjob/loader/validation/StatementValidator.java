package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class StatementValidator {

    private static final Logger LOGGER = Logger.getLogger(StatementValidator.class.getName());

    private StatementValidator() {}

    /**
     * Runs the rules and fails on the first error. Warnings are logged and returned.
     *
     * @throws ValidationException if any rule reports an error
     */
    public static List<LoaderMessage> validate(Statement statement, ValidationRunner runner)
            throws ValidationException {
        Objects.requireNonNull(runner, "runner");
        List<LoaderMessage> messages = runner.run(statement);
        LoaderMessage firstError =
                messages.stream()
                        .filter(message -> message.getLevel() == LoaderMessage.Level.ERROR)
                        .findFirst()
                        .orElse(null);
        if (firstError != null) {
            throw new ValidationException(
                    "Validation failed for statement " + statement.getDateRange() + ": " + firstError,
                    messages);
        }
        List<LoaderMessage> warnings =
                messages.stream()
                        .filter(message -> message.getLevel() == LoaderMessage.Level.WARNING)
                        .collect(Collectors.toList());
        for (LoaderMessage warning : warnings) {
            LOGGER.log(Level.WARNING, "Statement {0}: {1}", new Object[] {statement.getDateRange(), warning});
        }
        return warnings;
    }
}
