package com.learnscraper.scrape.api;

import java.util.List;

/**
 * Either an explicit URL list or pasted text with one URL per line. Both may be given; list
 * entries come first.
 */
public record BatchScrapeRequest(List<String> urls, String text) {
}
