package com.learnscraper.scrape.book;

import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.model.Article;
import com.learnscraper.scrape.toc.TocEntry;
import org.jsoup.nodes.Element;

/**
 * An article page that has been fetched and structured but whose images are not yet resolved.
 * Exactly one of {@code content} and {@code failure} is set.
 */
public record LoadedArticle(TocEntry entry, Element contentRoot, StructuredDocument content, Article failure) {

    static LoadedArticle loaded(TocEntry entry, Element contentRoot, StructuredDocument content) {
        return new LoadedArticle(entry, contentRoot, content, null);
    }

    static LoadedArticle failed(TocEntry entry, Article failure) {
        return new LoadedArticle(entry, null, null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
