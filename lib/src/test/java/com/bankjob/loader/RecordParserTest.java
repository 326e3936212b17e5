package com.bankjob.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bankjob.ledger.RecordFormatException;
import java.util.List;
import org.junit.jupiter.api.Test;

final class RecordParserTest {

    private final RecordParser parser = new RecordParser();

    @Test
    void splitsPlainAndQuotedFields() throws Exception {
        List<RecordRow> rows =
                parser.parse("test", "a,\"b, c\",\"say \"\"hi\"\"\",\nx,,z\n");

        assertEquals(2, rows.size());
        assertEquals(List.of("a", "b, c", "say \"hi\"", ""), rows.get(0).fields());
        assertEquals(List.of("x", "", "z"), rows.get(1).fields());
        assertEquals(2, rows.get(1).line());
    }

    @Test
    void acceptsMissingFinalNewlineAndCrLf() throws Exception {
        List<RecordRow> rows = parser.parse("test", "a,b\r\nc,d");
        assertEquals(List.of("a", "b"), rows.get(0).fields());
        assertEquals(List.of("c", "d"), rows.get(1).fields());
    }

    @Test
    void quotedFieldsMaySpanLines() throws Exception {
        List<RecordRow> rows = parser.parse("test", "\"two\nlines\",x\nnext\n");
        assertEquals(List.of("two\nlines", "x"), rows.get(0).fields());
        assertEquals(3, rows.get(1).line());
    }

    @Test
    void blankLinesParseAsBlankRows() throws Exception {
        List<RecordRow> rows = parser.parse("test", "a\n\nb\n");
        assertEquals(3, rows.size());
        assertTrue(rows.get(1).isBlank());
    }

    @Test
    void unterminatedQuoteIsAFormatError() {
        RecordFormatException ex =
                assertThrows(RecordFormatException.class, () -> parser.parse("broken.csv", "a,\"b\n"));
        assertEquals(1, ex.getLine());
        assertTrue(ex.getMessage().startsWith("broken.csv: column 3: "));
    }

    @Test
    void textAfterClosingQuoteIsAFormatError() {
        RecordFormatException ex =
                assertThrows(RecordFormatException.class, () -> parser.parse("test", "x\n\"a\"b,c\n"));
        assertEquals(2, ex.getLine());
    }
}
