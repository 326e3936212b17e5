package com.bankjob.loader;

import com.bankjob.ledger.RecordFormatException;
import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads transactions back from the CSV record format and appends them to a statement. Blank rows
 * and header rows are skipped, so files built by appending several statements load as one.
 */
public final class StatementLoader {

    private static final Logger LOGGER = Logger.getLogger(StatementLoader.class.getName());

    private final RecordParser parser = new RecordParser();

    public Statement load(Path path, char decimalSeparator, Statement target)
            throws IOException, RecordFormatException {
        Objects.requireNonNull(path, "path");
        String contents = Files.readString(path, StandardCharsets.UTF_8);
        return load(path.getFileName().toString(), contents, decimalSeparator, target);
    }

    public Statement load(Reader reader, char decimalSeparator, Statement target)
            throws IOException, RecordFormatException {
        Objects.requireNonNull(reader, "reader");
        StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        return load("<reader>", buffer.toString(), decimalSeparator, target);
    }

    public Statement load(String csv, char decimalSeparator, Statement target)
            throws RecordFormatException {
        return load("<string>", csv, decimalSeparator, target);
    }

    private Statement load(String sourceName, String csv, char decimalSeparator, Statement target)
            throws RecordFormatException {
        Objects.requireNonNull(target, "target");
        List<RecordRow> rows = parser.parse(sourceName, csv);
        int loaded = 0;
        for (RecordRow row : rows) {
            if (row.isBlank() || row.fields().equals(Transaction.RECORD_HEADER)) {
                continue;
            }
            target.addTransaction(toTransaction(sourceName, row, decimalSeparator));
            loaded++;
        }
        LOGGER.log(Level.FINE, "Loaded {0} transaction(s) from {1}", new Object[] {loaded, sourceName});
        return target;
    }

    private static Transaction toTransaction(String sourceName, RecordRow row, char decimalSeparator)
            throws RecordFormatException {
        try {
            return Transaction.fromRecordRow(row.fields(), decimalSeparator);
        } catch (RecordFormatException ex) {
            throw new RecordFormatException(sourceName + ": " + ex.getMessage(), row.line());
        } catch (DateTimeParseException ex) {
            throw new RecordFormatException(
                    sourceName + ": invalid date \"" + ex.getParsedString() + "\"", row.line());
        }
    }
}
