package com.bankjob.loader.validation;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.LoaderMessage;
import java.util.List;

/**
 * A single check over a statement that emits diagnostics. Rules report problems in the order they
 * find them.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given statement.
     *
     * @param statement Statement about to be exported.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(Statement statement);
}
