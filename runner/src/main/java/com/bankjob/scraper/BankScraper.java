package com.bankjob.scraper;

import com.bankjob.ledger.Statement;
import com.bankjob.rules.RuleEngine;
import java.util.List;

/** Produces statements for one bank. */
public interface BankScraper {

    String name();

    ScraperConfig config();

    /** Adds this bank's transaction rules to {@code rules}; called once per extraction session. */
    void registerRules(RuleEngine rules);

    /** Scrapes the current statement. Rules have not been applied yet. */
    Statement scrapeStatement(List<String> args) throws ScrapeException;
}
