package com.learnscraper.scrape.book;

import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.content.ContentStructurer;
import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.extract.FieldExtractor;
import com.learnscraper.scrape.http.DocumentFetcher;
import com.learnscraper.scrape.http.FetchException;
import com.learnscraper.scrape.meta.MetadataComputer;
import com.learnscraper.scrape.model.Article;
import com.learnscraper.scrape.model.ArticleMetadata;
import com.learnscraper.scrape.model.Image;
import com.learnscraper.scrape.toc.TocEntry;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * One article step of a book crawl: fetch, structure, resolve images, compute metadata. The step
 * can run whole or split into {@link #load} and {@link #complete}.
 * Any failure is returned as an error-marked {@link Article}; nothing is thrown to the caller.
 */
@Component
public class ArticleScraper {
    private static final Logger log = LoggerFactory.getLogger(ArticleScraper.class);

    private final DocumentFetcher documentFetcher;
    private final FieldExtractor fieldExtractor;
    private final ContentStructurer contentStructurer;
    private final ImageCollector imageCollector;
    private final MetadataComputer metadataComputer;
    private final ScraperProperties properties;

    public ArticleScraper(
        DocumentFetcher documentFetcher,
        FieldExtractor fieldExtractor,
        ContentStructurer contentStructurer,
        ImageCollector imageCollector,
        MetadataComputer metadataComputer,
        ScraperProperties properties
    ) {
        this.documentFetcher = documentFetcher;
        this.fieldExtractor = fieldExtractor;
        this.contentStructurer = contentStructurer;
        this.imageCollector = imageCollector;
        this.metadataComputer = metadataComputer;
        this.properties = properties;
    }

    public Article scrape(TocEntry entry, int chapterNumber, int articleNumber, CrawlSession session) {
        return complete(load(entry, chapterNumber, articleNumber, session, false), chapterNumber, articleNumber, session);
    }

    /**
     * Fetches and structures the article. With {@code prefetchImages} its image bytes are downloaded
     * as well, leaving only naming and storing to {@link #complete}.
     */
    public LoadedArticle load(
        TocEntry entry,
        int chapterNumber,
        int articleNumber,
        CrawlSession session,
        boolean prefetchImages
    ) {
        try {
            Document document = documentFetcher.fetch(
                entry.url(),
                Duration.ofSeconds(properties.getFetch().getWaitHintSeconds())
            );
            Element contentRoot = locateContent(document);
            StructuredDocument content = contentStructurer.structure(contentRoot);
            if (prefetchImages) {
                imageCollector.prefetch(contentRoot, session.assets());
            }
            return LoadedArticle.loaded(entry, contentRoot, content);
        } catch (FetchException e) {
            log.warn("Article {}.{} fetch failed for {}: {}", chapterNumber, articleNumber, entry.url(), e.getMessage());
            return LoadedArticle.failed(entry, Article.failed(articleNumber, entry.title(), entry.url(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Article {}.{} extraction failed for {}", chapterNumber, articleNumber, entry.url(), e);
            return LoadedArticle.failed(
                entry,
                Article.failed(articleNumber, entry.title(), entry.url(), String.valueOf(e.getMessage()))
            );
        }
    }

    /**
     * Resolves images and computes metadata. Callers complete articles in table-of-contents order so
     * stored asset names do not depend on which fetch finished first.
     */
    public Article complete(LoadedArticle loaded, int chapterNumber, int articleNumber, CrawlSession session) {
        if (loaded.isFailed()) {
            return loaded.failure();
        }
        TocEntry entry = loaded.entry();
        try {
            List<Image> images = imageCollector.collect(loaded.contentRoot(), chapterNumber, articleNumber, session.assets());
            ArticleMetadata metadata = metadataComputer.compute(chapterNumber, loaded.content());
            return Article.extracted(articleNumber, entry.title(), entry.url(), loaded.content(), images, metadata);
        } catch (RuntimeException e) {
            log.warn("Article {}.{} extraction failed for {}", chapterNumber, articleNumber, entry.url(), e);
            return Article.failed(articleNumber, entry.title(), entry.url(), String.valueOf(e.getMessage()));
        }
    }

    Element locateContent(Document document) {
        Element content = fieldExtractor.locate(document, BookFieldRules.ARTICLE_CONTENT);
        return content != null ? content : document.body();
    }
}
