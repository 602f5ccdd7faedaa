package com.learnscraper.scrape.model;

import java.time.Instant;
import java.util.List;

/**
 * @param cancelled true when the crawl was stopped before every discovered article was visited
 */
public record Book(
    String title,
    String description,
    String url,
    Instant scrapedAt,
    List<Chapter> chapters,
    BookTotals totals,
    boolean cancelled
) {
    public Book {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }
}
