package com.bankjob.scraper;

import java.util.Objects;

/**
 * A fetched page, handed from a {@link PageFetcher} to the {@link ExtractionRule} that understands
 * it. The content is whatever document model the two agree on (parsed HTML, JSON, plain text).
 */
public final class PageDocument {
    private final String location;
    private final Object content;

    private PageDocument(String location, Object content) {
        this.location = Objects.requireNonNull(location, "location");
        this.content = Objects.requireNonNull(content, "content");
    }

    public static PageDocument of(String location, Object content) {
        return new PageDocument(location, content);
    }

    /** Where the page came from; used in diagnostics. */
    public String getLocation() {
        return location;
    }

    public Object getContent() {
        return content;
    }

    /**
     * @throws ScrapeException if the content is not a {@code type}
     */
    public <T> T contentAs(Class<T> type) throws ScrapeException {
        if (!type.isInstance(content)) {
            throw new ScrapeException(
                    "Page "
                            + location
                            + " holds "
                            + content.getClass().getName()
                            + ", expected "
                            + type.getName());
        }
        return type.cast(content);
    }

    @Override
    public String toString() {
        return "PageDocument{" + location + "}";
    }
}
