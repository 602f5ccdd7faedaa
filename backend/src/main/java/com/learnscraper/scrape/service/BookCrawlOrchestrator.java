package com.learnscraper.scrape.service;

import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.asset.AssetDeduplicator;
import com.learnscraper.scrape.asset.AssetStore;
import com.learnscraper.scrape.book.ArticleScraper;
import com.learnscraper.scrape.book.BookFieldRules;
import com.learnscraper.scrape.book.CrawlCancellation;
import com.learnscraper.scrape.book.CrawlSession;
import com.learnscraper.scrape.book.LoadedArticle;
import com.learnscraper.scrape.extract.FieldExtractor;
import com.learnscraper.scrape.http.DocumentFetcher;
import com.learnscraper.scrape.http.FetchException;
import com.learnscraper.scrape.http.PoliteHttpClient;
import com.learnscraper.scrape.model.Article;
import com.learnscraper.scrape.model.Book;
import com.learnscraper.scrape.model.BookTotals;
import com.learnscraper.scrape.model.Chapter;
import com.learnscraper.scrape.model.ScrapeResult;
import com.learnscraper.scrape.toc.TableOfContentsResolver;
import com.learnscraper.scrape.toc.TocEntry;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Crawls a book: root document, table of contents, then every article in discovery order.
 * Only a root fetch failure fails the whole crawl; article failures stay inline at their position.
 */
@Service
public class BookCrawlOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BookCrawlOrchestrator.class);
    static final String DEFAULT_TITLE = "Untitled Book";
    private static final Pattern PLATFORM_TITLE_SUFFIX =
        Pattern.compile("\\s*-\\s*Zoho\\s+Learn.*$", Pattern.CASE_INSENSITIVE);

    private final DocumentFetcher documentFetcher;
    private final FieldExtractor fieldExtractor;
    private final TableOfContentsResolver tocResolver;
    private final ArticleScraper articleScraper;
    private final PoliteHttpClient httpClient;
    private final AssetStore assetStore;
    private final ScraperProperties properties;
    private final Clock clock;
    private final ExecutorService articleExecutor;

    public BookCrawlOrchestrator(
        DocumentFetcher documentFetcher,
        FieldExtractor fieldExtractor,
        TableOfContentsResolver tocResolver,
        ArticleScraper articleScraper,
        PoliteHttpClient httpClient,
        AssetStore assetStore,
        ScraperProperties properties,
        Clock clock,
        @Qualifier("articleExecutor") ExecutorService articleExecutor
    ) {
        this.documentFetcher = documentFetcher;
        this.fieldExtractor = fieldExtractor;
        this.tocResolver = tocResolver;
        this.articleScraper = articleScraper;
        this.httpClient = httpClient;
        this.assetStore = assetStore;
        this.properties = properties;
        this.clock = clock;
        this.articleExecutor = articleExecutor;
    }

    public ScrapeResult<Book> scrapeCollection(String url) {
        return scrapeCollection(url, CrawlCancellation.none());
    }

    public ScrapeResult<Book> scrapeCollection(String url, CrawlCancellation cancellation) {
        Instant scrapedAt = clock.instant();
        Document root;
        try {
            root = documentFetcher.fetch(url, Duration.ofSeconds(properties.getFetch().getWaitHintSeconds()));
        } catch (FetchException e) {
            log.warn("Book root fetch failed for {}: {}", url, e.getMessage());
            return ScrapeResult.failure("Error processing book: " + e.getMessage(), url, scrapedAt);
        }

        String title = bookTitle(root);
        String description = fieldExtractor.extract(root, BookFieldRules.DESCRIPTION);
        List<TocEntry> toc = tocResolver.resolve(root, url);
        log.info(
            "Crawling book '{}' from {}: chapters={}, articles={}",
            title,
            url,
            toc.size(),
            toc.stream().mapToInt(chapter -> chapter.children().size()).sum()
        );

        Article[][] slots = new Article[toc.size()][];
        for (int i = 0; i < toc.size(); i++) {
            slots[i] = new Article[toc.get(i).children().size()];
        }

        boolean cancelled;
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);
        try (CrawlSession session = new CrawlSession(url, assets, cancellation)) {
            if (properties.getCrawl().getArticleConcurrency() > 1) {
                cancelled = crawlParallel(toc, slots, session);
            } else {
                cancelled = crawlSequential(toc, slots, session);
            }
        }

        Book book = aggregate(title, description, url, scrapedAt, toc, slots, cancelled);
        log.info(
            "Book crawl {} for {}: chapters={}, articles={}, images={}",
            cancelled ? "cancelled" : "completed",
            url,
            book.totals().chapterCount(),
            book.totals().articleCount(),
            book.totals().imageCount()
        );
        return ScrapeResult.success(book);
    }

    String bookTitle(Document root) {
        String raw = fieldExtractor.extract(root, BookFieldRules.TITLE);
        if (raw == null) {
            return DEFAULT_TITLE;
        }
        String cleaned = PLATFORM_TITLE_SUFFIX.matcher(raw).replaceFirst("").trim();
        return cleaned.isEmpty() ? DEFAULT_TITLE : cleaned;
    }

    /**
     * @return true when the crawl stopped before visiting every article
     */
    private boolean crawlSequential(List<TocEntry> toc, Article[][] slots, CrawlSession session) {
        long delayMs = properties.getCrawl().getPolitenessDelayMs();
        boolean first = true;
        for (int i = 0; i < toc.size(); i++) {
            TocEntry chapter = toc.get(i);
            log.info("Chapter {}: {} ({} articles)", i + 1, chapter.title(), chapter.children().size());
            for (int j = 0; j < chapter.children().size(); j++) {
                if (session.isCancelled()) {
                    log.info("Book crawl for {} cancelled before article {}.{}", session.bookUrl(), i + 1, j + 1);
                    return true;
                }
                if (!first && delayMs > 0) {
                    try {
                        Thread.sleep(delayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.info("Book crawl for {} interrupted before article {}.{}", session.bookUrl(), i + 1, j + 1);
                        return true;
                    }
                }
                first = false;
                slots[i][j] = articleScraper.scrape(chapter.children().get(j), i + 1, j + 1, session);
                logArticle(slots[i][j], i + 1);
            }
        }
        return false;
    }

    // Pages and image bytes load concurrently; images are named and stored in discovery order.
    private boolean crawlParallel(List<TocEntry> toc, Article[][] slots, CrawlSession session) {
        List<CompletableFuture<LoadedArticle>> futures = new ArrayList<>();
        List<int[]> positions = new ArrayList<>();
        for (int i = 0; i < toc.size(); i++) {
            TocEntry chapter = toc.get(i);
            for (int j = 0; j < chapter.children().size(); j++) {
                TocEntry entry = chapter.children().get(j);
                int chapterNumber = i + 1;
                int articleNumber = j + 1;
                futures.add(CompletableFuture.supplyAsync(
                    () -> session.isCancelled()
                        ? null
                        : articleScraper.load(entry, chapterNumber, articleNumber, session, true),
                    articleExecutor
                ));
                positions.add(new int[] {i, j});
            }
        }

        boolean cancelled = false;
        for (int k = 0; k < futures.size(); k++) {
            int i = positions.get(k)[0];
            int j = positions.get(k)[1];
            TocEntry entry = toc.get(i).children().get(j);
            Article article;
            try {
                LoadedArticle loaded = futures.get(k).join();
                if (loaded == null) {
                    cancelled = true;
                    continue;
                }
                article = articleScraper.complete(loaded, i + 1, j + 1, session);
            } catch (CompletionException e) {
                log.warn("Article {}.{} task failed for {}", i + 1, j + 1, entry.url(), e);
                article = Article.failed(j + 1, entry.title(), entry.url(), String.valueOf(e.getCause()));
            }
            slots[i][j] = article;
            logArticle(article, i + 1);
        }
        return cancelled;
    }

    private Book aggregate(
        String title,
        String description,
        String url,
        Instant scrapedAt,
        List<TocEntry> toc,
        Article[][] slots,
        boolean cancelled
    ) {
        List<Chapter> chapters = new ArrayList<>();
        int articleCount = 0;
        int imageCount = 0;
        for (int i = 0; i < toc.size(); i++) {
            List<Article> articles = new ArrayList<>();
            for (Article article : slots[i]) {
                if (article == null) {
                    continue;
                }
                articles.add(article);
                if (article.images() != null) {
                    imageCount += article.images().size();
                }
            }
            if (articles.isEmpty()) {
                continue;
            }
            articleCount += articles.size();
            chapters.add(new Chapter(i + 1, toc.get(i).title(), articles));
        }
        BookTotals totals = new BookTotals(chapters.size(), articleCount, imageCount);
        return new Book(title, description, url, scrapedAt, chapters, totals, cancelled);
    }

    private void logArticle(Article article, int chapterNumber) {
        if (article.isFailed()) {
            log.info("Article {}.{} '{}' failed: {}", chapterNumber, article.number(), article.title(), article.error());
        } else {
            log.info(
                "Article {}.{} '{}': words={}, images={}",
                chapterNumber,
                article.number(),
                article.title(),
                article.metadata().wordCount(),
                article.images().size()
            );
        }
    }
}
