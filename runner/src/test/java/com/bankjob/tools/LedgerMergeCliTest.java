package com.bankjob.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import com.bankjob.output.RecordWriter;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

final class LedgerMergeCliTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    @Test
    void printsMergedLedger() throws Exception {
        Path dir = Files.createTempDirectory("bankjob-cli");
        Path existing = write(dir.resolve("existing.csv"), 3, 2, 1);
        Path incoming = write(dir.resolve("incoming.csv"), 5, 4, 3);

        int status = LedgerMergeCli.run(new String[] {existing.toString(), incoming.toString()}, out, err);

        assertEquals(0, status, errBytes.toString(StandardCharsets.UTF_8));
        String[] lines = outBytes.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(String.join(",", Transaction.RECORD_HEADER), lines[0]);
        assertEquals(6, lines.length);
        assertTrue(lines[1].contains("ENTRY 5"));
        assertTrue(lines[5].contains("ENTRY 1"));
    }

    @Test
    void windowOfExistingLedgerPrintsTheLedger() throws Exception {
        Path dir = Files.createTempDirectory("bankjob-cli");
        Path existing = write(dir.resolve("existing.csv"), 5, 4, 3, 2, 1);
        Path incoming = write(dir.resolve("incoming.csv"), 4, 3);

        int status = LedgerMergeCli.run(new String[] {existing.toString(), incoming.toString()}, out, err);

        assertEquals(0, status, errBytes.toString(StandardCharsets.UTF_8));
        assertEquals(Files.readString(existing, StandardCharsets.UTF_8), outBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void reportsConflict() throws Exception {
        Path dir = Files.createTempDirectory("bankjob-cli");
        Path existing = write(dir.resolve("existing.csv"), 3, 2, 1);
        Path incoming = write(dir.resolve("incoming.csv"), 5, 2);

        int status = LedgerMergeCli.run(new String[] {existing.toString(), incoming.toString()}, out, err);

        assertEquals(1, status);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).startsWith("Failed to merge statement"));
    }

    @Test
    void usageErrors() {
        assertEquals(2, LedgerMergeCli.run(new String[] {"one.csv"}, out, err));
        assertEquals(2, LedgerMergeCli.run(new String[] {"a.csv", "b.csv", ";"}, out, err));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).startsWith("Usage: LedgerMergeCli"));
    }

    @Test
    void missingFile() throws Exception {
        Path dir = Files.createTempDirectory("bankjob-cli");
        Path existing = write(dir.resolve("existing.csv"), 1);

        int status =
                LedgerMergeCli.run(
                        new String[] {existing.toString(), dir.resolve("absent.csv").toString()}, out, err);

        assertEquals(1, status);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Ledger file not found"));
    }

    private static Path write(Path file, int... days) throws Exception {
        Statement statement = new Statement("1");
        for (int day : days) {
            Transaction transaction = new Transaction();
            transaction.setDate(LocalDateTime.of(2009, 2, day, 12, 0));
            transaction.setRawDescription("ENTRY " + day);
            transaction.setAmount("-" + day + ".25");
            transaction.setNewBalance(String.valueOf(100 - day));
            statement.addTransaction(transaction);
        }
        Files.writeString(file, new RecordWriter().toString(statement, true), StandardCharsets.UTF_8);
        return file;
    }
}
