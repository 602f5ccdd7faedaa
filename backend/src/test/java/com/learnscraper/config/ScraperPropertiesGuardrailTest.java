package com.learnscraper.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("learn-scraper/0.1"));
    }

    @Test
    void crawlSettingsAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.getCrawl().setArticleConcurrency(0);
        properties.getCrawl().setPolitenessDelayMs(-10);
        properties.setRequestTimeoutSeconds(0);
        properties.setRequestMaxRetries(-1);
        assertEquals(1, properties.getCrawl().getArticleConcurrency());
        assertEquals(0, properties.getCrawl().getPolitenessDelayMs());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(0, properties.getRequestMaxRetries());
    }

    @Test
    void defaultsMatchPoliteCrawling() {
        ScraperProperties properties = new ScraperProperties();
        assertEquals(1000, properties.getCrawl().getPolitenessDelayMs());
        assertEquals(1, properties.getCrawl().getArticleConcurrency());
        assertEquals(5, properties.getFetch().getWaitHintSeconds());
    }
}
