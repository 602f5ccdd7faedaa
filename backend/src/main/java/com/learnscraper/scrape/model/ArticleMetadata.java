package com.learnscraper.scrape.model;

import java.util.List;

public record ArticleMetadata(
    int chapterNumber,
    int wordCount,
    int readingTimeMinutes,
    Difficulty difficulty,
    List<Integer> reviewIntervalsDays,
    String contentType
) {
}
