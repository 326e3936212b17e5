package com.bankjob.testing;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import java.time.LocalDateTime;

/** Builds small statements whose transaction {@code n} is dated day {@code n} of October 2008. */
public final class TestStatements {

    public static final String ACCOUNT = "12345";

    private TestStatements() {}

    public static Transaction transaction(int n) {
        Transaction transaction = new Transaction(',');
        transaction.setDate(LocalDateTime.of(2008, 10, n, 0, 0));
        transaction.setValueDate(LocalDateTime.of(2008, 10, n, 0, 0));
        transaction.setRawDescription("MOVEMENT " + n);
        transaction.setAmount("-" + n + ",50");
        transaction.setNewBalance((1000 - n) + ",00");
        return transaction;
    }

    /** A statement holding fresh transactions {@code numbers}, in the order given. */
    public static Statement statement(int... numbers) {
        Statement statement = new Statement(ACCOUNT);
        for (int n : numbers) {
            statement.addTransaction(transaction(n));
        }
        return statement;
    }
}
