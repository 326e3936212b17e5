package com.bankjob.scraper;

import com.bankjob.rules.RuleEngine;
import com.bankjob.rules.StandardRules;
import java.util.ArrayList;
import java.util.List;

/**
 * Scraper over an in-memory page. Transaction {@code n} is dated day {@code n} of October 2008 and
 * rows are listed most recent first, as banks show them.
 */
public final class FixedPageScraper extends TemplateScraper {

    private final List<RawTransaction> rows;
    private final List<List<String>> fetchedWith = new ArrayList<>();

    public FixedPageScraper(ScraperConfig config, int... days) {
        super("fixed", config);
        List<RawTransaction> list = new ArrayList<>();
        for (int day : days) {
            list.add(row(day));
        }
        this.rows = list;
    }

    public static RawTransaction row(int day) {
        return new RawTransaction(
                String.format("%02d/10/2008", day),
                null,
                "PAYMENT " + day,
                "-" + day + ",00",
                (500 - day) + ",00");
    }

    public static ScraperConfig commaConfig() {
        return ScraperConfig.builder().accountNumber("0001234").decimalSeparator(',').build();
    }

    public List<List<String>> fetchedWith() {
        return fetchedWith;
    }

    @Override
    protected PageFetcher fetcher() {
        return args -> {
            fetchedWith.add(args);
            return PageDocument.of("memory:page", rows);
        };
    }

    @Override
    protected ExtractionRule extractionRule() {
        return page -> {
            List<?> content = page.contentAs(List.class);
            List<RawTransaction> extracted = new ArrayList<>();
            for (Object item : content) {
                extracted.add((RawTransaction) item);
            }
            return extracted;
        };
    }

    @Override
    public void registerRules(RuleEngine rules) {
        super.registerRules(rules);
        rules.register(RuleEngine.LAST, "capitalize", StandardRules.capitalizeUncustomized());
    }
}
