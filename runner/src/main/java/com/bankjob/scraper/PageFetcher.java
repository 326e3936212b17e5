package com.bankjob.scraper;

import java.util.List;

/** Logs in to a bank site and returns the page listing the latest transactions. */
@FunctionalInterface
public interface PageFetcher {

    /**
     * @param args scraper-specific arguments, typically credentials
     */
    PageDocument fetch(List<String> args) throws ScrapeException;
}
