package com.learnscraper.scrape.http;

import org.jsoup.nodes.Document;

import java.time.Duration;

public interface DocumentFetcher {
    /**
     * @param url      absolute page URL
     * @param waitHint how long a rendering fetcher may wait for scripts to settle; static fetchers ignore it
     * @return the parsed page, with its base URI set to the final (post-redirect) URL
     * @throws FetchException when the page cannot be retrieved
     */
    Document fetch(String url, Duration waitHint) throws FetchException;
}
