package com.learnscraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a top-level scrape: either the extracted record or a single error record.
 * Serializes as whichever one is present.
 */
public record ScrapeResult<T>(T value, ScrapeError error) {
    public ScrapeResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value or error must be set");
        }
    }

    public static <T> ScrapeResult<T> success(T value) {
        return new ScrapeResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ScrapeResult<T> failure(String message, String url, Instant scrapedAt) {
        return new ScrapeResult<>(null, new ScrapeError(message, url, scrapedAt));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return value != null;
    }

    @JsonValue
    public Object serialized() {
        return value != null ? value : error;
    }
}
