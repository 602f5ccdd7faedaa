package com.learnscraper.scrape.model;

import java.util.List;

public record BatchJobSummary(
    int requested,
    int succeeded,
    int failed,
    boolean cancelled,
    List<BatchJobOutcome> outcomes
) {
    public BatchJobSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
