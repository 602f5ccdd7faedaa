package com.learnscraper.scrape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnscraper.scrape.book.CrawlCancellation;
import com.learnscraper.scrape.model.BatchJobOutcome;
import com.learnscraper.scrape.model.BatchJobSummary;
import com.learnscraper.scrape.model.JobPosting;
import com.learnscraper.scrape.model.ScrapeResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scrapes a list of job posting URLs one after another. Every URL gets an outcome, including the
 * failed ones; a cancelled batch simply stops adding outcomes.
 */
@Service
public class BatchJobScraper {
    private static final Logger log = LoggerFactory.getLogger(BatchJobScraper.class);
    static final String MANIFEST_FILE = "manifest.csv";
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final JobPostingScraper jobPostingScraper;
    private final ObjectMapper objectMapper;

    public BatchJobScraper(JobPostingScraper jobPostingScraper, ObjectMapper objectMapper) {
        this.jobPostingScraper = jobPostingScraper;
        this.objectMapper = objectMapper;
    }

    /**
     * Keeps the trimmed lines that start with {@code http}, in order.
     */
    public static List<String> parseUrls(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null) {
            return urls;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("http")) {
                urls.add(trimmed);
            }
        }
        return urls;
    }

    public BatchJobSummary scrape(List<String> urls) {
        return scrape(urls, CrawlCancellation.none());
    }

    public BatchJobSummary scrape(List<String> urls, CrawlCancellation cancellation) {
        List<BatchJobOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;
        int succeeded = 0;
        for (int i = 0; i < urls.size(); i++) {
            if (cancellation.isCancelled()) {
                log.info("Batch scrape cancelled after {} of {} URLs", i, urls.size());
                cancelled = true;
                break;
            }
            int index = i + 1;
            String url = urls.get(i);
            log.info("[{}/{}] Scraping {}", index, urls.size(), url);
            ScrapeResult<JobPosting> result = jobPostingScraper.scrape(url);
            if (result.isSuccessful()) {
                succeeded++;
            }
            outcomes.add(new BatchJobOutcome(index, url, fileName(index, result), result.isSuccessful(), result));
        }
        log.info("Batch scrape finished: requested={}, succeeded={}, failed={}",
            urls.size(), succeeded, outcomes.size() - succeeded);
        return new BatchJobSummary(urls.size(), succeeded, outcomes.size() - succeeded, cancelled, outcomes);
    }

    /**
     * Writes one JSON file per outcome plus a {@code manifest.csv} listing them.
     *
     * @return path of the manifest
     */
    public Path write(BatchJobSummary summary, Path directory) throws IOException {
        Files.createDirectories(directory);
        for (BatchJobOutcome outcome : summary.outcomes()) {
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(directory.resolve(outcome.fileName()).toFile(), outcome.result());
        }
        Path manifest = directory.resolve(MANIFEST_FILE);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader("index", "url", "file_name", "success")
            .build();
        try (Writer writer = Files.newBufferedWriter(manifest, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (BatchJobOutcome outcome : summary.outcomes()) {
                printer.printRecord(outcome.index(), outcome.url(), outcome.fileName(), outcome.success());
            }
        }
        log.info("Wrote {} batch results and manifest to {}", summary.outcomes().size(), directory);
        return manifest;
    }

    static String fileName(int index, ScrapeResult<JobPosting> result) {
        String prefix = String.format(Locale.ROOT, "job_%03d", index);
        if (!result.isSuccessful()) {
            return prefix + "_error.json";
        }
        JobPosting posting = result.value();
        String title = sanitize(posting.title() == null ? "job_" + index : posting.title(), 30);
        String company = sanitize(posting.company(), 20);
        if (company.isEmpty()) {
            return prefix + "_" + title + ".json";
        }
        return prefix + "_" + title + "_" + company + ".json";
    }

    static String sanitize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String cleaned = UNSAFE_CHARS.matcher(text).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned.trim()).replaceAll("_");
        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength);
        }
        return cleaned.toLowerCase(Locale.ROOT);
    }
}
