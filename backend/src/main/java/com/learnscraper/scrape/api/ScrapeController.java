package com.learnscraper.scrape.api;

import com.learnscraper.scrape.model.BatchJobSummary;
import com.learnscraper.scrape.model.Book;
import com.learnscraper.scrape.model.JobPosting;
import com.learnscraper.scrape.model.ScrapeResult;
import com.learnscraper.scrape.service.BatchJobScraper;
import com.learnscraper.scrape.service.BookCrawlOrchestrator;
import com.learnscraper.scrape.service.JobPostingScraper;
import com.learnscraper.scrape.units.LearningUnitRenderer;
import com.learnscraper.scrape.util.UrlUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Scrape results are returned as the record on success. A failed root fetch answers 502 with the
 * error record as the body.
 */
@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final JobPostingScraper jobPostingScraper;
    private final BookCrawlOrchestrator bookCrawlOrchestrator;
    private final LearningUnitRenderer learningUnitRenderer;
    private final BatchJobScraper batchJobScraper;

    public ScrapeController(
        JobPostingScraper jobPostingScraper,
        BookCrawlOrchestrator bookCrawlOrchestrator,
        LearningUnitRenderer learningUnitRenderer,
        BatchJobScraper batchJobScraper
    ) {
        this.jobPostingScraper = jobPostingScraper;
        this.bookCrawlOrchestrator = bookCrawlOrchestrator;
        this.learningUnitRenderer = learningUnitRenderer;
        this.batchJobScraper = batchJobScraper;
    }

    @PostMapping("/job")
    public ResponseEntity<ScrapeResult<JobPosting>> scrapeJob(@RequestBody ScrapeRequest request) {
        return respond(jobPostingScraper.scrape(requireUrl(request)));
    }

    @PostMapping("/book")
    public ResponseEntity<ScrapeResult<Book>> scrapeBook(@RequestBody ScrapeRequest request) {
        return respond(bookCrawlOrchestrator.scrapeCollection(requireUrl(request)));
    }

    @PostMapping("/book/learning-units")
    public ResponseEntity<Object> scrapeLearningUnits(@RequestBody ScrapeRequest request) {
        ScrapeResult<Book> result = bookCrawlOrchestrator.scrapeCollection(requireUrl(request));
        if (!result.isSuccessful()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result.error());
        }
        return ResponseEntity.ok(learningUnitRenderer.render(result.value()));
    }

    @PostMapping("/jobs/batch")
    public BatchJobSummary scrapeJobs(@RequestBody BatchScrapeRequest request) {
        List<String> urls = new ArrayList<>();
        if (request != null && request.urls() != null) {
            for (String url : request.urls()) {
                if (url != null && !url.isBlank()) {
                    urls.add(UrlUtils.requireHttpUrl(url));
                }
            }
        }
        if (request != null) {
            urls.addAll(BatchJobScraper.parseUrls(request.text()));
        }
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("no job URLs given");
        }
        return batchJobScraper.scrape(urls);
    }

    private String requireUrl(ScrapeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body with url is required");
        }
        return UrlUtils.requireHttpUrl(request.url());
    }

    private <T> ResponseEntity<ScrapeResult<T>> respond(ScrapeResult<T> result) {
        if (result.isSuccessful()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
    }
}
