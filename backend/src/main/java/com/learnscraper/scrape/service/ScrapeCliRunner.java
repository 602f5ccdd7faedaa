package com.learnscraper.scrape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.model.BatchJobSummary;
import com.learnscraper.scrape.model.Book;
import com.learnscraper.scrape.model.JobPosting;
import com.learnscraper.scrape.model.ScrapeResult;
import com.learnscraper.scrape.units.LearningUnitRenderer;
import com.learnscraper.scrape.units.LearningUnitsView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ScraperProperties properties;
    private final JobPostingScraper jobPostingScraper;
    private final BookCrawlOrchestrator bookCrawlOrchestrator;
    private final LearningUnitRenderer learningUnitRenderer;
    private final BatchJobScraper batchJobScraper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        JobPostingScraper jobPostingScraper,
        BookCrawlOrchestrator bookCrawlOrchestrator,
        LearningUnitRenderer learningUnitRenderer,
        BatchJobScraper batchJobScraper,
        ObjectMapper objectMapper,
        Clock clock,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobPostingScraper = jobPostingScraper;
        this.bookCrawlOrchestrator = bookCrawlOrchestrator;
        this.learningUnitRenderer = learningUnitRenderer;
        this.batchJobScraper = batchJobScraper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!properties.getCli().isRun()) {
            return;
        }

        Path outputDir = Path.of(properties.getOutput().getDir());
        Files.createDirectories(outputDir);
        String stamp = STAMP.format(clock.instant());
        boolean allSucceeded = true;

        String jobUrl = properties.getCli().getJobUrl();
        if (jobUrl != null && !jobUrl.isBlank()) {
            ScrapeResult<JobPosting> result = jobPostingScraper.scrape(jobUrl.trim());
            Path file = writeJson(outputDir.resolve("job_" + stamp + ".json"), result);
            if (result.isSuccessful()) {
                JobPosting posting = result.value();
                log.info(
                    "Job summary: title={}, company={}, location={}, requirements={}, skills={}, file={}",
                    posting.title(),
                    posting.company(),
                    posting.location(),
                    posting.requirements().size(),
                    posting.skills().size(),
                    file
                );
            } else {
                allSucceeded = false;
                log.warn("Job scrape failed: {}", result.error().error());
            }
        }

        String bookUrl = properties.getCli().getBookUrl();
        if (bookUrl != null && !bookUrl.isBlank()) {
            ScrapeResult<Book> result = bookCrawlOrchestrator.scrapeCollection(bookUrl.trim());
            Path file = writeJson(outputDir.resolve("book_" + stamp + ".json"), result);
            if (result.isSuccessful()) {
                Book book = result.value();
                LearningUnitsView units = learningUnitRenderer.render(book);
                Path unitsFile = writeJson(outputDir.resolve("book_" + stamp + "_learning_units.json"), units);
                log.info(
                    "Book summary: title={}, chapters={}, articles={}, images={}, words={}, readingMinutes={}, files={}, {}",
                    book.title(),
                    book.totals().chapterCount(),
                    book.totals().articleCount(),
                    book.totals().imageCount(),
                    units.summary().totalWords(),
                    units.summary().estimatedTotalReadingTimeMinutes(),
                    file,
                    unitsFile
                );
            } else {
                allSucceeded = false;
                log.warn("Book scrape failed: {}", result.error().error());
            }
        }

        String batchFile = properties.getCli().getBatchFile();
        if (batchFile != null && !batchFile.isBlank()) {
            List<String> urls = BatchJobScraper.parseUrls(Files.readString(Path.of(batchFile.trim()), StandardCharsets.UTF_8));
            BatchJobSummary summary = batchJobScraper.scrape(urls);
            Path manifest = batchJobScraper.write(summary, outputDir.resolve("batch_" + stamp));
            log.info(
                "Batch summary: requested={}, succeeded={}, failed={}, manifest={}",
                summary.requested(),
                summary.succeeded(),
                summary.failed(),
                manifest
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int status = allSucceeded ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }

    private Path writeJson(Path file, Object value) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
