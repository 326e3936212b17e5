package com.bankjob.runner;

import com.bankjob.ledger.LedgerException;
import com.bankjob.ledger.MergeConflictException;
import com.bankjob.ledger.Statement;
import com.bankjob.loader.StatementLoader;
import com.bankjob.loader.validation.ValidationRunner;
import com.bankjob.output.OfxDocumentWriter;
import com.bankjob.output.RecordWriter;
import com.bankjob.scraper.BankScraper;
import com.bankjob.scraper.ExtractionSession;
import com.bankjob.scraper.ScrapeException;
import com.bankjob.scraper.ScraperConfig;
import com.bankjob.scraper.TemplateScraper;
import com.bankjob.upload.StatementUploader;
import com.bankjob.upload.UploadException;
import com.bankjob.upload.UploadStatus;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Runs one extraction end to end: scrape, apply the scraper's rules, then write CSV, write OFX
 * and upload as the options ask.
 *
 * <p>CSV written to an existing file is merged with what the file already holds. Both are taken
 * to list transactions most recent first, so the new statement goes in front of the stored one.
 * When they do not line up the new statement is kept in a {@code _merge_failed} file next to the
 * original, which is left untouched.</p>
 */
public final class BankjobRunner {

    public static final String ROOT_LOGGER = "com.bankjob";

    private static final Logger LOGGER = Logger.getLogger(BankjobRunner.class.getName());

    private final RecordWriter recordWriter = new RecordWriter();
    private final StatementLoader statementLoader = new StatementLoader();

    /**
     * Sends {@code com.bankjob} logging at {@code level} and above to the console, or to
     * {@code logFile} (appending) when one is given.
     */
    public static void configureLogging(Level level, Path logFile) throws IOException {
        Objects.requireNonNull(level, "level");
        Logger root = Logger.getLogger(ROOT_LOGGER);
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
            handler.close();
        }
        Handler handler = logFile == null ? new ConsoleHandler() : new FileHandler(logFile.toString(), true);
        handler.setLevel(level);
        handler.setFormatter(new SimpleFormatter());
        root.addHandler(handler);
        root.setLevel(level);
        root.setUseParentHandlers(false);
    }

    /**
     * @param uploader sink for the OFX document; only used when the options ask for an upload
     * @return 0 on success, 1 on failure (the reason is printed to {@code console})
     */
    public int run(
            RunnerOptions options, BankScraper scraper, StatementUploader uploader, PrintStream console) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(scraper, "scraper");
        Objects.requireNonNull(console, "console");

        if (options.getInput() != null) {
            if (scraper instanceof TemplateScraper template) {
                template.setInputOverride(options.getInput());
            } else {
                LOGGER.log(
                        Level.WARNING,
                        "Scraper {0} cannot read a saved page; ignoring input {1}",
                        new Object[] {scraper.name(), options.getInput()});
            }
        }

        ExtractionSession session = new ExtractionSession(scraper);
        Statement statement;
        try {
            statement = session.run(options.getScraperArgs());
        } catch (ScrapeException | RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Scraping with " + scraper.name() + " failed", ex);
            console.println(
                    "Failed to scrape a statement successfully with "
                            + scraper.name()
                            + " due to: "
                            + ex.getMessage());
            return 1;
        }

        try {
            if (options.isCsv()) {
                writeCsv(options.getCsvTarget(), statement, session, console);
            }
            if (options.isOfx() || options.isUpload()) {
                ValidationRunner validation =
                        options.isStrictAmounts()
                                ? ValidationRunner.strictRules()
                                : ValidationRunner.defaultRules();
                String document = new OfxDocumentWriter(validation).toString(List.of(statement));
                if (options.isOfx()) {
                    writeOfx(options.getOfxTarget(), statement, document, console);
                }
                if (options.isUpload()) {
                    return upload(uploader, document, console);
                }
            }
        } catch (IOException | LedgerException ex) {
            LOGGER.log(Level.SEVERE, "Writing statement " + statement.getDateRange() + " failed", ex);
            console.println("Failed to write statement: " + ex.getMessage());
            return 1;
        }
        return 0;
    }

    private void writeCsv(
            Path target, Statement statement, ExtractionSession session, PrintStream console)
            throws IOException, LedgerException {
        if (target == null) {
            console.print(recordWriter.toString(statement, true));
            return;
        }
        Path file = resolveTarget(target, statement, "csv");
        if (!Files.isRegularFile(file)) {
            writeRecords(file, statement);
            LOGGER.log(Level.INFO, "Statement written as CSV to {0}", file);
            return;
        }

        // the record format does not keep transaction types, so the stored rows go through the
        // same rules before they are compared with the fresh ones
        ScraperConfig config = session.scraper().config();
        Statement stored = statementLoader.load(file, config.getDecimalSeparator(), config.createStatement());
        session.rules().applyAll(stored);
        if (stored.containsAll(statement)) {
            LOGGER.log(
                    Level.INFO,
                    "{0} already holds every transaction of {1}, left unchanged",
                    new Object[] {file, statement.getDateRange()});
            return;
        }
        Statement merged;
        try {
            merged = statement.merge(stored);
        } catch (MergeConflictException ex) {
            Path failed = mergeFailedPath(file, statement);
            writeRecords(failed, statement);
            LOGGER.log(
                    Level.WARNING,
                    "Merge failed, storing new data in {0} instead of merging it into {1}",
                    new Object[] {failed, file});
            LOGGER.log(Level.FINE, "Merge failure", ex);
            return;
        }
        writeRecords(file, merged);
        LOGGER.log(
                Level.INFO,
                "Statement {0} merged into {1}, now {2} transaction(s)",
                new Object[] {statement.getDateRange(), file, merged.getTransactions().size()});
    }

    private void writeOfx(Path target, Statement statement, String document, PrintStream console)
            throws IOException {
        if (target == null) {
            console.print(document);
            return;
        }
        Path file = resolveTarget(target, statement, "ofx");
        Files.writeString(file, document, StandardCharsets.UTF_8);
        LOGGER.log(Level.INFO, "Statement written as OFX to {0}", file);
    }

    private static int upload(StatementUploader uploader, String document, PrintStream console) {
        if (uploader == null) {
            console.println("Upload requested but no uploader is configured");
            return 1;
        }
        try {
            UploadStatus status = uploader.upload(document);
            if (!status.accepted()) {
                LOGGER.log(Level.SEVERE, "Upload refused: {0}", status.message());
                console.println("Upload refused: " + status.message());
                return 1;
            }
            LOGGER.log(Level.INFO, "Upload accepted: {0}", status.message());
            return 0;
        } catch (UploadException ex) {
            LOGGER.log(Level.SEVERE, "Upload failed", ex);
            console.println("Failed to upload: " + ex.getMessage());
            return 1;
        }
    }

    private void writeRecords(Path file, Statement statement) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            recordWriter.write(statement, true, out);
        }
    }

    /** A directory target gets {@code yyyyMMdd-yyyyMMdd.<extension>}; anything else is used as is. */
    static Path resolveTarget(Path target, Statement statement, String extension) {
        if (Files.isDirectory(target)) {
            return target.resolve(statement.getDateRangeLabel() + "." + extension);
        }
        return target;
    }

    static Path mergeFailedPath(Path file, Statement statement) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        return file.resolveSibling(
                base + "_" + statement.getDateRangeLabel() + "_merge_failed" + extension);
    }
}
