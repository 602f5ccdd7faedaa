package com.learnscraper.config;

/**
 * Raised while wiring the scraper when a required capability is missing.
 * Always fatal: the application context refuses to start.
 */
public class ScraperConfigurationException extends RuntimeException {
    public ScraperConfigurationException(String message) {
        super(message);
    }
}
