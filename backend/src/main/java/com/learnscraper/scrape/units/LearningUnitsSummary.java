package com.learnscraper.scrape.units;

public record LearningUnitsSummary(
    int totalLearningUnits,
    int totalChapters,
    int totalImages,
    int totalWords,
    int estimatedTotalReadingTimeMinutes
) {
}
