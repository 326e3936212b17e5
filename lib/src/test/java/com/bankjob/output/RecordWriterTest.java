package com.bankjob.output;

import static com.bankjob.testing.TestStatements.statement;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bankjob.ledger.Statement;
import com.bankjob.loader.StatementLoader;
import java.util.List;
import org.junit.jupiter.api.Test;

final class RecordWriterTest {

    private final RecordWriter writer = new RecordWriter();

    @Test
    void quotesOnlyFieldsThatNeedIt() {
        Statement s = statement(1);
        s.getTransactions().get(0).setRawDescription("say \"hi\", twice");
        s.getTransactions().get(0).setDescription("Two\nlines");

        String row = writer.toString(s, false);

        assertTrue(row.startsWith("2008-10-01 00:00:00,2008-10-01 00:00:00,\"Two\nlines\",-1.50,"));
        assertTrue(row.endsWith(",\"say \"\"hi\"\", twice\"," + s.getTransactions().get(0).getId() + "\n"));
    }

    @Test
    void readsBackWhatItWrites() throws Exception {
        Statement s = statement(2, 1);
        s.getTransactions().get(0).setRawDescription("#1 \"ACME\", LTD ");

        Statement loaded = new StatementLoader().load(writer.toString(s, true), ',', new Statement());

        assertEquals(s.getTransactions(), loaded.getTransactions());
        assertEquals("#1 \"ACME\", LTD ", loaded.getTransactions().get(0).getRawDescription());
    }

    @Test
    void writesHeaderOnlyWhenAsked() {
        Statement s = statement(1);

        String withHeader = writer.toString(s, true);
        String withoutHeader = writer.toString(s, false);

        assertTrue(
                withHeader.startsWith(
                        "Date,Value-Date,Description,Amount,New-Balance,Raw-Amount,Raw-New-Balance,"
                                + "Raw-Description,OFX-ID\n"));
        assertTrue(withoutHeader.startsWith("2008-10-01 00:00:00,2008-10-01 00:00:00,MOVEMENT 1,-1.50,999.00,"));
        assertEquals(withHeader.length(), withoutHeader.length() + withHeader.indexOf('\n') + 1);
    }

    @Test
    void writesStatementsInOrder() throws Exception {
        StringBuilder out = new StringBuilder();
        writer.write(List.of(statement(4, 3), statement(2)), false, out);

        String[] lines = out.toString().split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[2].contains("MOVEMENT 2"));
        // raw amounts keep the comma and get quoted
        assertTrue(lines[0].contains(",\"-4,50\",\"996,00\","));
    }
}
