package com.bankjob.scraper;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import com.bankjob.rules.RuleEngine;
import com.bankjob.rules.StandardRules;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scraper skeleton: fetch the transactions page, extract raw rows, and turn them into a
 * statement built from the {@link ScraperConfig}. Subclasses supply the fetcher and extraction
 * rule and usually add their own transaction rules on top of the sign-based typing registered
 * here.
 *
 * <p>For debugging an extraction rule against a saved page, {@link #setInputOverride(Path)} makes
 * the scraper read that file through {@link #loadInput(Path)} instead of fetching.</p>
 */
public abstract class TemplateScraper implements BankScraper {

    private static final Logger LOGGER = Logger.getLogger(TemplateScraper.class.getName());

    private final String name;
    private final ScraperConfig config;
    private Path inputOverride;

    protected TemplateScraper(String name, ScraperConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
    }

    protected abstract PageFetcher fetcher();

    protected abstract ExtractionRule extractionRule();

    @Override
    public String name() {
        return name;
    }

    @Override
    public ScraperConfig config() {
        return config;
    }

    public void setInputOverride(Path input) {
        this.inputOverride = input;
    }

    @Override
    public void registerRules(RuleEngine rules) {
        rules.register(RuleEngine.LAST, "debit-or-credit-by-sign", StandardRules.debitOrCreditBySign());
    }

    @Override
    public final Statement scrapeStatement(List<String> args) throws ScrapeException {
        PageDocument page;
        if (inputOverride != null) {
            LOGGER.log(Level.INFO, "{0}: reading page from {1} instead of fetching", new Object[] {name, inputOverride});
            page = loadInput(inputOverride);
        } else {
            page = fetcher().fetch(List.copyOf(args));
        }

        List<RawTransaction> rows = extractionRule().extract(page);
        Statement statement = config.createStatement();
        for (RawTransaction row : rows) {
            statement.addTransaction(toTransaction(page, row));
        }
        completeStatement(statement, page);
        LOGGER.log(
                Level.INFO,
                "{0}: scraped {1} transaction(s) from {2}",
                new Object[] {name, rows.size(), page.getLocation()});
        return statement;
    }

    /**
     * Hook for pages that show closing balances or a date range separately from the transaction
     * rows. Does nothing by default.
     */
    protected void completeStatement(Statement statement, PageDocument page) throws ScrapeException {}

    /** Reads a saved page as text. Override when the extraction rule expects a parsed document. */
    protected PageDocument loadInput(Path input) throws ScrapeException {
        try {
            return PageDocument.of(input.toString(), Files.readString(input, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ScrapeException("Failed to read input page " + input, ex);
        }
    }

    private Transaction toTransaction(PageDocument page, RawTransaction row) throws ScrapeException {
        Transaction transaction = config.createTransaction();
        try {
            transaction.setDate(row.date());
            transaction.setValueDate(row.valueDate());
        } catch (DateTimeParseException ex) {
            throw new ScrapeException(
                    "Unrecognized date \"" + ex.getParsedString() + "\" on " + page.getLocation(), ex);
        }
        transaction.setRawDescription(row.description());
        transaction.setAmount(row.amount());
        transaction.setNewBalance(row.newBalance());
        return transaction;
    }
}
