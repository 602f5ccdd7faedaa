package com.learnscraper.scrape.http;

import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Blocking GET with bounded retries. Transport failures come back as error-coded
 * {@link HttpFetchResult}s rather than exceptions; 408, 429, 5xx and transport errors are retried
 * with jittered exponential backoff.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.5";
    private static final Set<String> NON_RETRYABLE_ERRORS = Set.of("invalid_url", "interrupted");

    private final ScraperProperties properties;
    private final HttpClient client;

    public PoliteHttpClient(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        int attempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult result = executeOnce(url, acceptHeader);
        for (int attempt = 1; attempt < attempts && isRetryable(result); attempt++) {
            log.debug("Retrying {} after attempt {}: {}", url, attempt, result.failureReason());
            if (!pauseBeforeRetry(attempt)) {
                break;
            }
            result = executeOnce(url, acceptHeader);
        }
        return result;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        HttpRequest request = buildRequest(url, acceptHeader);
        if (request == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return responseResult(url, response, startedAt);
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpRequest buildRequest(String url, String acceptHeader) {
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader)
            .header("Accept-Language", ACCEPT_LANGUAGE)
            .GET()
            .build();
    }

    private HttpFetchResult responseResult(String url, HttpResponse<byte[]> response, Instant startedAt) {
        byte[] bytes = response.body();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        HttpFetchResult raw = new HttpFetchResult(
            url, response.uri(), response.statusCode(), null, bytes, contentType,
            Instant.now(), Duration.between(startedAt, Instant.now()), null, null
        );
        if (bytes == null) {
            return raw;
        }
        Charset charset = raw.declaredCharset();
        String text = new String(bytes, charset == null ? StandardCharsets.UTF_8 : charset);
        return new HttpFetchResult(
            url, raw.finalUri(), raw.statusCode(), text, bytes, contentType,
            raw.fetchedAt(), raw.duration(), null, null
        );
    }

    private boolean isRetryable(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return !NON_RETRYABLE_ERRORS.contains(result.errorCode());
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Sleeps between half and all of the capped exponential delay for this attempt.
     *
     * @return false when interrupted
     */
    private boolean pauseBeforeRetry(int attempt) {
        long delayMs = (long) properties.getRequestRetryBaseDelayMs() << Math.min(attempt - 1, 20);
        int capMs = properties.getRequestRetryMaxDelayMs();
        if (capMs > 0) {
            delayMs = Math.min(delayMs, capMs);
        }
        if (delayMs <= 0) {
            return true;
        }
        long half = delayMs / 2;
        try {
            Thread.sleep(half + ThreadLocalRandom.current().nextLong(Math.max(1L, delayMs - half)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        Instant now = Instant.now();
        return new HttpFetchResult(url, null, 0, null, null, null, now, Duration.between(startedAt, now), code, message);
    }

    // Scheme-less input is treated as https.
    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        String withScheme = value.startsWith("http://") || value.startsWith("https://") ? value : "https://" + value;
        try {
            return new URI(withScheme);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
