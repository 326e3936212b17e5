package com.bankjob.rules;

import static com.bankjob.testing.TestStatements.transaction;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.bankjob.ledger.Transaction;
import com.bankjob.ledger.TransactionType;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

final class StandardRulesTest {

    @Test
    void typesBySign() {
        TransactionRule rule = StandardRules.debitOrCreditBySign();
        Transaction debit = transaction(1);
        Transaction credit = transaction(1);
        credit.setAmount("10,00");
        Transaction zero = transaction(1);
        zero.setAmount("0,00");
        Transaction fee = transaction(1);
        fee.setType(TransactionType.FEE);

        rule.apply(debit);
        rule.apply(credit);
        rule.apply(zero);
        rule.apply(fee);

        assertEquals(TransactionType.DEBIT, debit.getType());
        assertEquals(TransactionType.CREDIT, credit.getType());
        assertEquals(TransactionType.OTHER, zero.getType());
        assertEquals(TransactionType.FEE, fee.getType());
    }

    @Test
    void capitalizesOnlyUntouchedDescriptions() {
        TransactionRule rule = StandardRules.capitalizeUncustomized();
        Transaction untouched = transaction(1);
        Transaction custom = transaction(2);
        custom.setDescription("ELECTRICITY");

        rule.apply(untouched);
        rule.apply(custom);

        assertEquals("Movement 1", untouched.getDescription());
        assertEquals("ELECTRICITY", custom.getDescription());
    }

    @Test
    void recognisesChecks() {
        TransactionRule rule =
                StandardRules.checkNumber(
                        Pattern.compile("CHEQUE\\s+(\\d+)", Pattern.CASE_INSENSITIVE),
                        "Cheque #%1$s withdrawn %2$s");
        Transaction transaction = transaction(3);
        transaction.setRawDescription("CHEQUE 0012345 LOJA");

        rule.apply(transaction);

        assertEquals(TransactionType.CHECK, transaction.getType());
        assertEquals("0012345", transaction.getCheckNumber());
        assertEquals("Cheque #0012345 withdrawn LOJA", transaction.getDescription());
    }

    @Test
    void recognisesAtmWithdrawals() {
        TransactionRule rule =
                StandardRules.atmWithdrawal(
                        Pattern.compile("LEV.*ATM ELEC\\s+\\d+/\\d+\\s+", Pattern.CASE_INSENSITIVE),
                        "Multibanco withdrawal at ");
        Transaction withdrawal = transaction(4);
        withdrawal.setRawDescription("LEV ATM ELEC 12/10 LISBOA");
        Transaction deposit = transaction(4);
        deposit.setRawDescription("LEV ATM ELEC 12/10 LISBOA");
        deposit.setAmount("20,00");

        rule.apply(withdrawal);
        rule.apply(deposit);

        assertEquals(TransactionType.ATM, withdrawal.getType());
        assertEquals("Multibanco withdrawal at LISBOA", withdrawal.getDescription());
        assertEquals(TransactionType.OTHER, deposit.getType());
        assertNull(deposit.getCheckNumber());
    }
}
