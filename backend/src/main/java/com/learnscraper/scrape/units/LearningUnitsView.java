package com.learnscraper.scrape.units;

import java.time.Instant;
import java.util.List;

public record LearningUnitsView(
    String bookTitle,
    String bookDescription,
    Instant scrapedAt,
    List<LearningUnit> learningUnits,
    LearningUnitsSummary summary
) {
    public LearningUnitsView {
        learningUnits = learningUnits == null ? List.of() : List.copyOf(learningUnits);
    }
}
