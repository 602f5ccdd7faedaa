package com.learnscraper.scrape.http;

import com.learnscraper.config.ScraperProperties;
import com.learnscraper.scrape.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new ScraperProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setUserAgent("learn-scraper-test/1.0");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorThenSucceeds() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>").setHeader("Content-Type", "text/html"));
        properties.setRequestMaxRetries(1);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/page").toString(), "text/html");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(result.contentType()).isEqualTo("text/html");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void bodyTextUsesDeclaredCharset() throws Exception {
        byte[] latin1 = "Gr\u00fc\u00dfe".getBytes(StandardCharsets.ISO_8859_1);
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/plain; charset=\"iso-8859-1\"")
            .setBody(new Buffer().write(latin1)));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/greeting").toString(), "text/plain");

        assertThat(result.declaredCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(result.body()).isEqualTo("Gr\u00fc\u00dfe");
        assertThat(result.bodyBytes()).isEqualTo(latin1);
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        properties.setRequestMaxRetries(3);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/html");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.failureReason()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void sendsConfiguredHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        properties.setRequestMaxRetries(0);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        client.get(server.url("/headers").toString(), "image/*");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("learn-scraper-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("image/*");
    }

    @Test
    void malformedUrlIsReportedWithoutRequest() {
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get("https://", "text/html");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }
}
