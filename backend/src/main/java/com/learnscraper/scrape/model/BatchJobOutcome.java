package com.learnscraper.scrape.model;

/**
 * @param index 1-based position of the URL in the batch
 * @param fileName name the result is written under when the batch is saved
 */
public record BatchJobOutcome(
    int index,
    String url,
    String fileName,
    boolean success,
    ScrapeResult<JobPosting> result
) {
}
