package com.learnscraper.scrape.http;

import com.learnscraper.scrape.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Duration;

/**
 * Plain HTTP rendition of {@link DocumentFetcher}. The page is decoded from raw bytes with the
 * Content-Type charset when one is declared, otherwise jsoup reads the BOM or meta charset and falls
 * back to UTF-8.
 */
public class HttpDocumentFetcher implements DocumentFetcher {
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public HttpDocumentFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Document fetch(String url, Duration waitHint) throws FetchException {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (!result.isSuccessful()) {
            throw new FetchException(url, "Failed to fetch " + url + " (" + result.failureReason() + ")");
        }
        String baseUri = result.finalUrlOrRequested();
        if (result.bodyBytes() == null) {
            return Jsoup.parse("", baseUri);
        }
        Charset charset = result.declaredCharset();
        try {
            return Jsoup.parse(
                new ByteArrayInputStream(result.bodyBytes()),
                charset == null ? null : charset.name(),
                baseUri
            );
        } catch (IOException e) {
            throw new FetchException(url, "Failed to parse " + url + " (" + e.getMessage() + ")", e);
        }
    }
}
