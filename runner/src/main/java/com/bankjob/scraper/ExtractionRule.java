package com.bankjob.scraper;

import java.util.List;

/** Maps a site's markup to raw transaction rows, in the order the site lists them. */
@FunctionalInterface
public interface ExtractionRule {

    List<RawTransaction> extract(PageDocument page) throws ScrapeException;
}
