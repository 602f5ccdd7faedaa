package com.learnscraper.scrape.http;

import java.io.IOException;

public class FetchException extends IOException {
    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
