package com.bankjob.scraper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** Scrapers known by name, registered explicitly by whoever assembles the application. */
public final class ScraperRegistry {

    private final Map<String, Supplier<? extends BankScraper>> factories = new LinkedHashMap<>();

    public ScraperRegistry register(String name, Supplier<? extends BankScraper> factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Scraper already registered: " + name);
        }
        return this;
    }

    /**
     * @throws ScrapeException if no scraper is registered under {@code name}
     */
    public BankScraper create(String name) throws ScrapeException {
        Supplier<? extends BankScraper> factory = factories.get(name);
        if (factory == null) {
            throw new ScrapeException("Unknown scraper " + name + "; known scrapers: " + names());
        }
        return factory.get();
    }

    /** Registered names, in registration order. */
    public List<String> names() {
        return List.copyOf(factories.keySet());
    }
}
