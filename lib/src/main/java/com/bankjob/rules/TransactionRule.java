package com.bankjob.rules;

import com.bankjob.ledger.Transaction;

/** Post-processes one scraped transaction in place: its type, description, payee or check number. */
@FunctionalInterface
public interface TransactionRule {

    void apply(Transaction transaction);
}
