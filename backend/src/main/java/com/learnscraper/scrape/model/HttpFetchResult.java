package com.learnscraper.scrape.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    private static final Pattern CHARSET_PARAM = Pattern.compile("charset\\s*=\\s*[\"']?([^\\s;\"']+)", Pattern.CASE_INSENSITIVE);


    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String failureReason() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }

    /**
     * @return the supported charset named by the Content-Type header, or null when none is declared
     */
    public Charset declaredCharset() {
        if (contentType == null) {
            return null;
        }
        Matcher matcher = CHARSET_PARAM.matcher(contentType);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).toUpperCase(Locale.ROOT);
        try {
            return Charset.isSupported(name) ? Charset.forName(name) : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }
}
