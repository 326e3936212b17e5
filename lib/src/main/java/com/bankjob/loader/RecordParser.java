package com.bankjob.loader;

import com.bankjob.ledger.RecordFormatException;
import com.bankjob.loader.grammar.LedgerRecordBaseVisitor;
import com.bankjob.loader.grammar.LedgerRecordLexer;
import com.bankjob.loader.grammar.LedgerRecordParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/** Splits CSV text into rows of unquoted field values using the {@code LedgerRecord} grammar. */
public final class RecordParser {

    public List<RecordRow> parse(String sourceName, String input) throws RecordFormatException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");
        String text = input;
        if (!text.isEmpty() && !text.endsWith("\n") && !text.endsWith("\r")) {
            text = text + "\n";
        }

        RecordErrorListener errors = new RecordErrorListener(sourceName);
        LedgerRecordLexer lexer = new LedgerRecordLexer(CharStreams.fromString(text, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LedgerRecordParser parser = new LedgerRecordParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            return new RowBuildingVisitor().build(parser.file());
        } catch (RecordErrorListener.RecordSyntaxError ex) {
            RecordFormatException failure = new RecordFormatException(ex.getMessage(), ex.getLine());
            failure.initCause(ex);
            throw failure;
        }
    }

    private static final class RowBuildingVisitor extends LedgerRecordBaseVisitor<String> {

        List<RecordRow> build(LedgerRecordParser.FileContext context) {
            List<RecordRow> rows = new ArrayList<>(context.row().size());
            for (LedgerRecordParser.RowContext row : context.row()) {
                List<String> fields = new ArrayList<>(row.field().size());
                for (LedgerRecordParser.FieldContext field : row.field()) {
                    fields.add(visit(field));
                }
                rows.add(new RecordRow(row.getStart().getLine(), fields));
            }
            return rows;
        }

        @Override
        public String visitPlainField(LedgerRecordParser.PlainFieldContext ctx) {
            return ctx.TEXT().getText();
        }

        @Override
        public String visitQuotedField(LedgerRecordParser.QuotedFieldContext ctx) {
            String quoted = ctx.STRING().getText();
            return quoted.substring(1, quoted.length() - 1).replace("\"\"", "\"");
        }

        @Override
        public String visitEmptyField(LedgerRecordParser.EmptyFieldContext ctx) {
            return "";
        }
    }
}
