package com.learnscraper.scrape.model;

public record BookTotals(int chapterCount, int articleCount, int imageCount) {
}
