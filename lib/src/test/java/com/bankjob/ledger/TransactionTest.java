package com.bankjob.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bankjob.testing.TestStatements;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TransactionTest {

    @Test
    void identityIgnoresPresentationFields() {
        Transaction first = TestStatements.transaction(3);
        Transaction second = TestStatements.transaction(3);
        second.setDescription("Groceries");
        second.setPayee(new Payee("Continente"));
        second.setCheckNumber("77");
        second.setValueDate(first.getValueDate().plusDays(2));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.getId(), second.getId());
    }

    @Test
    void identityCoversTypeAndBalance() {
        Transaction base = TestStatements.transaction(3);
        Transaction retyped = TestStatements.transaction(3);
        retyped.setType(TransactionType.DEBIT);
        Transaction rebalanced = TestStatements.transaction(3);
        rebalanced.setNewBalance("1,00");

        assertNotEquals(base, retyped);
        assertNotEquals(base, rebalanced);
        assertNotEquals(base.getId(), retyped.getId());
    }

    @Test
    void idIsCachedOnceComputed() {
        Transaction transaction = TestStatements.transaction(4);
        String id = transaction.getId();
        assertEquals(32, id.length());

        transaction.setAmount("-99,00");

        assertEquals(id, transaction.getId());
        assertEquals(id, transaction.copy().getId());
    }

    @Test
    void assignedIdIsKept() {
        Transaction transaction = TestStatements.transaction(4);
        transaction.setId("from-file");
        assertEquals("from-file", transaction.getId());
    }

    @Test
    void realValuesUseTheSeparator() {
        Transaction transaction = TestStatements.transaction(5);
        assertEquals(new BigDecimal("-5.50"), transaction.getRealAmount());
        assertEquals(new BigDecimal("995.00"), transaction.getRealNewBalance());
    }

    @Test
    void effectiveDescriptionPrefixesPayee() {
        Transaction transaction = TestStatements.transaction(1);
        assertEquals("MOVEMENT 1", transaction.getEffectiveDescription());
        assertFalse(transaction.isDescriptionCustomized());

        transaction.setDescription("Rent");
        transaction.setPayee(new Payee("Landlord"));

        assertEquals("Landlord - Rent", transaction.getEffectiveDescription());
        assertTrue(transaction.isDescriptionCustomized());
    }

    @Test
    void recordRowRoundTrip() throws Exception {
        Transaction original = TestStatements.transaction(7);
        List<String> row = original.toRecordRow();

        assertEquals(
                List.of(
                        "2008-10-07 00:00:00",
                        "2008-10-07 00:00:00",
                        "MOVEMENT 7",
                        "-7.50",
                        "993.00",
                        "-7,50",
                        "993,00",
                        "MOVEMENT 7",
                        original.getId()),
                row);

        Transaction loaded = Transaction.fromRecordRow(row, ',');
        assertEquals(original, loaded);
        assertEquals(original.getId(), loaded.getId());
    }

    @Test
    void recordRowNeedsNineFields() {
        RecordFormatException ex =
                assertThrows(
                        RecordFormatException.class,
                        () -> Transaction.fromRecordRow(List.of("2008-10-07", "x"), '.'));
        assertTrue(ex.getMessage().contains("9 fields"));
    }

    @Test
    void ofxElementOmitsAbsentOptionalParts() {
        Transaction transaction = TestStatements.transaction(2);
        transaction.setType(TransactionType.DEBIT);

        OfxElement element = transaction.toOfxElement();

        assertEquals("STMTTRN", element.getName());
        assertEquals(List.of("TRNTYPE", "DTPOSTED", "TRNAMT", "FITID", "MEMO"), element.childNames());
        assertEquals("DEBIT", element.childText("TRNTYPE"));
        assertEquals("20081002000000", element.childText("DTPOSTED"));
        assertNull(element.child("PAYEE"));
    }

    @Test
    void ofxElementIncludesCheckAndPayee() {
        Transaction transaction = TestStatements.transaction(2);
        transaction.setCheckNumber("1234");
        Payee payee = new Payee("EDP");
        payee.setCity("Lisboa");
        transaction.setPayee(payee);

        OfxElement element = transaction.toOfxElement();

        assertEquals(
                List.of("TRNTYPE", "DTPOSTED", "TRNAMT", "FITID", "CHECKNUM", "PAYEE", "MEMO"),
                element.childNames());
        OfxElement payeeElement = element.child("PAYEE");
        assertEquals(
                List.of("NAME", "ADDR1", "CITY", "STATE", "POSTALCODE", "PHONE"),
                payeeElement.childNames());
        assertEquals("Lisboa", payeeElement.childText("CITY"));
        assertEquals("", payeeElement.childText("PHONE"));
        assertEquals("EDP - MOVEMENT 2", element.childText("MEMO"));
    }
}
