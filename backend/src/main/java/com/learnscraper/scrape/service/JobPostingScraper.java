package com.learnscraper.scrape.service;

import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.http.DocumentFetcher;
import com.learnscraper.scrape.http.FetchException;
import com.learnscraper.scrape.jobs.JobPostingExtractor;
import com.learnscraper.scrape.model.JobPosting;
import com.learnscraper.scrape.model.ScrapeResult;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class JobPostingScraper {
    private static final Logger log = LoggerFactory.getLogger(JobPostingScraper.class);

    private final DocumentFetcher documentFetcher;
    private final JobPostingExtractor extractor;
    private final ScraperProperties properties;
    private final Clock clock;

    public JobPostingScraper(
        DocumentFetcher documentFetcher,
        JobPostingExtractor extractor,
        ScraperProperties properties,
        Clock clock
    ) {
        this.documentFetcher = documentFetcher;
        this.extractor = extractor;
        this.properties = properties;
        this.clock = clock;
    }

    public ScrapeResult<JobPosting> scrape(String url) {
        Instant scrapedAt = clock.instant();
        Document document;
        try {
            document = documentFetcher.fetch(url, Duration.ofSeconds(properties.getFetch().getWaitHintSeconds()));
        } catch (FetchException e) {
            log.warn("Job posting fetch failed for {}: {}", url, e.getMessage());
            return ScrapeResult.failure("Error processing page: " + e.getMessage(), url, scrapedAt);
        }
        try {
            JobPosting posting = extractor.extract(document, url, scrapedAt);
            log.info("Scraped job posting {} ({})", posting.title(), url);
            return ScrapeResult.success(posting);
        } catch (RuntimeException e) {
            log.warn("Job posting extraction failed for {}", url, e);
            return ScrapeResult.failure("Error processing page: " + e.getMessage(), url, scrapedAt);
        }
    }
}
