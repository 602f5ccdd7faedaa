package com.learnscraper.scrape.book;

import com.learnscraper.scrape.asset.AssetDeduplicator;

/**
 * State shared by the article steps of one book crawl. Nothing here outlives the crawl.
 */
public class CrawlSession implements AutoCloseable {
    private final String bookUrl;
    private final AssetDeduplicator assets;
    private final CrawlCancellation cancellation;

    public CrawlSession(String bookUrl, AssetDeduplicator assets, CrawlCancellation cancellation) {
        this.bookUrl = bookUrl;
        this.assets = assets;
        this.cancellation = cancellation == null ? CrawlCancellation.none() : cancellation;
    }

    public String bookUrl() {
        return bookUrl;
    }

    public AssetDeduplicator assets() {
        return assets;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    @Override
    public void close() {
        assets.clear();
    }
}
