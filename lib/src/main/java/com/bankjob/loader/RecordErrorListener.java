package com.bankjob.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Stops lexing or parsing a record file at the first error, remembering where it happened. */
final class RecordErrorListener extends BaseErrorListener {
    private final String sourceName;

    RecordErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new RecordSyntaxError(
                line, sourceName + ": column " + (charPositionInLine + 1) + ": " + msg, e);
    }

    static final class RecordSyntaxError extends ParseCancellationException {
        private final int line;

        RecordSyntaxError(int line, String message, Throwable cause) {
            super(message, cause);
            this.line = line;
        }

        int getLine() {
            return line;
        }
    }
}
