package com.bankjob.loader;

import com.bankjob.loader.grammar.LedgerRecordLexer;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "bankjob.debugTokens";
    /** Consulted only when the system property is unset. */
    private static final String TOKENS_ENV = "BANKJOB_DEBUG_TOKENS";
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(CommonTokenStream tokens, LedgerRecordLexer lexer) {
        StringBuilder dump = new StringBuilder("Record token dump:");
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            dump.append(System.lineSeparator())
                    .append(
                            String.format(
                                    Locale.ROOT,
                                    "  %-10s @ %4d:%-3d -> %s",
                                    symbolic,
                                    token.getLine(),
                                    token.getCharPositionInLine(),
                                    token.getText().replace("\n", "\\n").replace("\r", "\\r")));
        }
        LOGGER.info(dump.toString());
    }
}
