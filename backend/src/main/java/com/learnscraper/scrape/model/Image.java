package com.learnscraper.scrape.model;

public record Image(
    String sourceUrl,
    String localPath,
    String altText,
    String title,
    String caption
) {
}
