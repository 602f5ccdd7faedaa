package com.learnscraper.scrape.asset;

import com.learnscraper.scrape.http.PoliteHttpClient;
import com.learnscraper.scrape.model.HttpFetchResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetDeduplicatorTest {
    private static final String IMAGE_URL = "https://cdn.example.com/diagram.png";

    @Mock
    private PoliteHttpClient httpClient;

    @Mock
    private AssetStore assetStore;

    @Test
    void fiveReferencesTriggerOneFetch() throws Exception {
        when(httpClient.get(eq(IMAGE_URL), anyString())).thenReturn(ok(IMAGE_URL, "image/png"));
        when(assetStore.save(any(), eq("ch1_art1_img1.png"))).thenReturn(Path.of("images/ch1_art1_img1.png"));
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);

        List<String> paths = new ArrayList<>();
        for (int article = 1; article <= 5; article++) {
            paths.add(assets.resolve(IMAGE_URL, 1, article, 1));
        }

        verify(httpClient, times(1)).get(eq(IMAGE_URL), anyString());
        assertThat(paths).hasSize(5).containsOnly(Path.of("images/ch1_art1_img1.png").toString());
        assertThat(assets.storedCount()).isEqualTo(1);
    }

    @Test
    void concurrentLookupsStillFetchOnce() throws Exception {
        when(httpClient.get(eq(IMAGE_URL), anyString())).thenReturn(ok(IMAGE_URL, "image/png"));
        when(assetStore.save(any(), anyString())).thenReturn(Path.of("images/shared.png"));
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (int i = 1; i <= 8; i++) {
                int articleNumber = i;
                futures.add(CompletableFuture.supplyAsync(() -> assets.resolve(IMAGE_URL, 1, articleNumber, 1), executor));
            }
            for (CompletableFuture<String> future : futures) {
                assertThat(future.join()).isEqualTo(Path.of("images/shared.png").toString());
            }
        } finally {
            executor.shutdownNow();
        }

        verify(httpClient, times(1)).get(eq(IMAGE_URL), anyString());
    }

    @Test
    void prefetchDownloadsButFirstResolveNamesTheFile() throws Exception {
        when(httpClient.get(eq(IMAGE_URL), anyString())).thenReturn(ok(IMAGE_URL, "image/png"));
        when(assetStore.save(any(), eq("ch1_art1_img2.png"))).thenReturn(Path.of("images/ch1_art1_img2.png"));
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);

        assets.prefetch(IMAGE_URL);
        assets.prefetch(IMAGE_URL);
        verify(assetStore, never()).save(any(), anyString());
        assertThat(assets.storedCount()).isZero();

        assertThat(assets.resolve(IMAGE_URL, 1, 1, 2)).isEqualTo(Path.of("images/ch1_art1_img2.png").toString());
        assertThat(assets.resolve(IMAGE_URL, 3, 4, 1)).isEqualTo(Path.of("images/ch1_art1_img2.png").toString());

        verify(httpClient, times(1)).get(eq(IMAGE_URL), anyString());
        verify(assetStore, times(1)).save(any(), anyString());
    }

    @Test
    void failedDownloadResolvesToNullAndIsNotRetried() throws Exception {
        when(httpClient.get(eq(IMAGE_URL), anyString())).thenReturn(failed(IMAGE_URL));
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);

        assertThat(assets.resolve(IMAGE_URL, 2, 1, 1)).isNull();
        assertThat(assets.resolve(IMAGE_URL, 2, 2, 1)).isNull();

        verify(httpClient, times(1)).get(eq(IMAGE_URL), anyString());
        verify(assetStore, never()).save(any(), anyString());
        assertThat(assets.storedCount()).isZero();
    }

    @Test
    void storeFailureResolvesToNull() throws Exception {
        when(httpClient.get(eq(IMAGE_URL), anyString())).thenReturn(ok(IMAGE_URL, "image/gif"));
        when(assetStore.save(any(), eq("ch1_art2_img3.gif"))).thenThrow(new IOException("disk full"));
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);

        assertThat(assets.resolve(IMAGE_URL, 1, 2, 3)).isNull();
    }

    @Test
    void blankUrlIsNeverFetched() {
        AssetDeduplicator assets = new AssetDeduplicator(httpClient, assetStore);

        assertThat(assets.resolve(" ", 1, 1, 1)).isNull();

        verify(httpClient, never()).get(anyString(), anyString());
    }

    @Test
    void extensionFollowsContentType() {
        assertThat(AssetDeduplicator.extensionFor("image/png")).isEqualTo(".png");
        assertThat(AssetDeduplicator.extensionFor("image/GIF")).isEqualTo(".gif");
        assertThat(AssetDeduplicator.extensionFor("image/svg+xml")).isEqualTo(".svg");
        assertThat(AssetDeduplicator.extensionFor("image/webp")).isEqualTo(".webp");
        assertThat(AssetDeduplicator.extensionFor("image/jpeg")).isEqualTo(".jpg");
        assertThat(AssetDeduplicator.extensionFor(null)).isEqualTo(".jpg");
    }

    private static HttpFetchResult ok(String url, String contentType) {
        byte[] bytes = {1, 2, 3};
        return new HttpFetchResult(url, URI.create(url), 200, null, bytes, contentType, Instant.now(), Duration.ZERO, null, null);
    }

    private static HttpFetchResult failed(String url) {
        return new HttpFetchResult(url, null, 0, null, null, null, Instant.now(), Duration.ZERO, "timeout", "read timed out");
    }
}
