package com.learnscraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
