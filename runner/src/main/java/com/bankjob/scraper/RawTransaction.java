package com.bankjob.scraper;

/**
 * One transaction as it appears on the page, every field still the site's own text. Dates may use
 * any layout {@link com.bankjob.support.DateTimes#parseFlexible(Object)} understands; amounts use
 * the configured decimal separator. {@code valueDate} may be null.
 */
public record RawTransaction(
        String date, String valueDate, String description, String amount, String newBalance) {}
