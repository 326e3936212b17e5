package com.bankjob.tools;

import com.bankjob.ledger.LedgerException;
import com.bankjob.ledger.Statement;
import com.bankjob.loader.StatementLoader;
import com.bankjob.output.RecordWriter;
import com.bankjob.support.AmountParser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Merges two CSV ledgers and prints the result with a header. Both files list transactions most
 * recent first and {@code incoming} is the newer one, so its transactions come first.
 */
public final class LedgerMergeCli {

    private LedgerMergeCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2 || args.length > 3) {
            err.println("Usage: LedgerMergeCli <existing.csv> <incoming.csv> [decimal]");
            return 2;
        }
        Path existingPath = Path.of(args[0]).toAbsolutePath().normalize();
        Path incomingPath = Path.of(args[1]).toAbsolutePath().normalize();
        char decimal = AmountParser.PERIOD;
        if (args.length == 3) {
            if (args[2].length() != 1 || !isSeparator(args[2].charAt(0))) {
                err.println("Decimal separator must be '.' or ','");
                return 2;
            }
            decimal = args[2].charAt(0);
        }
        for (Path path : new Path[] {existingPath, incomingPath}) {
            if (!Files.isRegularFile(path)) {
                err.println("Ledger file not found: " + path);
                return 1;
            }
        }

        try {
            StatementLoader loader = new StatementLoader();
            Statement existing = loader.load(existingPath, decimal, new Statement());
            Statement incoming = loader.load(incomingPath, decimal, new Statement());
            // a re-read window of the existing ledger merges to the ledger itself
            Statement merged = existing.containsAll(incoming) ? existing : incoming.merge(existing);
            new RecordWriter().write(merged, true, out);
            out.flush();
            return 0;
        } catch (IOException | LedgerException ex) {
            err.println(ex.getMessage());
            return 1;
        }
    }

    private static boolean isSeparator(char c) {
        return c == AmountParser.PERIOD || c == AmountParser.COMMA;
    }
}
