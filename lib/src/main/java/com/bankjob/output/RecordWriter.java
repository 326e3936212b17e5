package com.bankjob.output;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes statements in the CSV record format read back by
 * {@link com.bankjob.loader.StatementLoader}. Quoting follows {@link CSVFormat#DEFAULT}; rows end
 * with {@code \n}.
 */
public final class RecordWriter {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

    public void write(List<Statement> statements, boolean header, Appendable out) throws IOException {
        Objects.requireNonNull(statements, "statements");
        Objects.requireNonNull(out, "out");
        // not closed: the caller owns out
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        if (header) {
            printer.printRecord(Transaction.RECORD_HEADER);
        }
        for (Statement statement : statements) {
            for (List<String> row : statement.toRecordRows()) {
                printer.printRecord(row);
            }
        }
        printer.flush();
    }

    public void write(Statement statement, boolean header, Appendable out) throws IOException {
        write(List.of(statement), header, out);
    }

    public String toString(Statement statement, boolean header) {
        StringBuilder builder = new StringBuilder();
        try {
            write(statement, header, builder);
        } catch (IOException ex) {
            // StringBuilder never throws
            throw new UncheckedIOException(ex);
        }
        return builder.toString();
    }
}
