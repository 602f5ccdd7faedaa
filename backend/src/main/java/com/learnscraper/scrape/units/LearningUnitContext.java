package com.learnscraper.scrape.units;

public record LearningUnitContext(String previousChapter, String sourceUrl) {
}
