package com.learnscraper.scrape.api;

public record ScrapeRequest(String url) {
}
