package com.learnscraper.scrape.model;

import java.time.Instant;

public record ScrapeError(String error, String url, Instant scrapedAt) {
}
