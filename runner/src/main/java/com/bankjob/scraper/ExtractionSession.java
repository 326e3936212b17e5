package com.bankjob.scraper;

import com.bankjob.ledger.Statement;
import com.bankjob.rules.RuleEngine;
import java.util.List;
import java.util.Objects;

/** One scraper and the rule engine holding its rules. */
public final class ExtractionSession {
    private final BankScraper scraper;
    private final RuleEngine rules = new RuleEngine();

    public ExtractionSession(BankScraper scraper) {
        this.scraper = Objects.requireNonNull(scraper, "scraper");
        scraper.registerRules(rules);
    }

    /** Scrapes a statement and post-processes it with the scraper's rules. */
    public Statement run(List<String> args) throws ScrapeException {
        return rules.applyAll(scraper.scrapeStatement(args));
    }

    public BankScraper scraper() {
        return scraper;
    }

    public RuleEngine rules() {
        return rules;
    }
}
