package com.learnscraper.scrape.book;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag. Crawls poll it between units of work and never interrupt a fetch in flight.
 */
public class CrawlCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CrawlCancellation none() {
        return new CrawlCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
